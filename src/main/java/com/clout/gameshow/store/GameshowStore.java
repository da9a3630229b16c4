package com.clout.gameshow.store;

import com.clout.gameshow.model.Phase;
import com.clout.gameshow.model.Player;
import com.clout.gameshow.model.PlayerSnapshot;
import com.clout.gameshow.model.Question;
import com.clout.gameshow.model.event.EventPayload;
import com.clout.gameshow.model.event.GameEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Shared state of the running game show.
 *
 * <p>Phase, questions, players and the event log each have their own lock. When more than
 * one is needed they are taken in that order (phase, questions, players, events); the
 * {@link OrderedLock}s reject any other order. Accessors check that the caller holds the
 * matching lock. The current question index is atomic and needs no lock.</p>
 */
public class GameshowStore {

    private final OrderedLock phaseLock = new OrderedLock("phase", 0);
    private final OrderedLock questionsLock = new OrderedLock("questions", 1);
    private final OrderedLock playersLock = new OrderedLock("players", 2);
    private final OrderedLock eventsLock = new OrderedLock("events", 3);

    // 0 = no question started, otherwise 1-based
    private final AtomicInteger currentQuestion = new AtomicInteger(0);

    private Phase phase = Phase.waiting(Phase.Stage.RESULTS);
    private List<Question> questions;
    private final List<Player> players = new ArrayList<>();
    private final List<GameEvent> events = new ArrayList<>();

    public GameshowStore(List<Question> questions) {
        this.questions = List.copyOf(questions);
    }

    public OrderedLock phaseLock() {
        return phaseLock;
    }

    public OrderedLock questionsLock() {
        return questionsLock;
    }

    public OrderedLock playersLock() {
        return playersLock;
    }

    public OrderedLock eventsLock() {
        return eventsLock;
    }

    // ----------------- phase -------------------

    public Phase getPhase() {
        phaseLock.requireHeld();
        return phase;
    }

    public void setPhase(Phase phase) {
        phaseLock.requireWriteHeld();
        this.phase = phase;
    }

    // ----------------- questions -------------------

    public List<Question> getQuestions() {
        questionsLock.requireHeld();
        return questions;
    }

    public void replaceQuestions(List<Question> newQuestions) {
        questionsLock.requireWriteHeld();
        this.questions = List.copyOf(newQuestions);
    }

    /**
     * The question currently being played. Fails if no question has started.
     */
    public Question getCurrentQuestion() {
        questionsLock.requireHeld();
        int index = currentQuestion.get();
        if (index < 1 || index > questions.size()) {
            throw new IllegalStateException("No active question (index " + index + ")");
        }
        return questions.get(index - 1);
    }

    // ----------------- question index -------------------

    public int getCurrentQuestionIndex() {
        return currentQuestion.get();
    }

    public int nextQuestionIndex() {
        return currentQuestion.incrementAndGet();
    }

    /**
     * Sets the index and returns the previous one.
     */
    public int swapQuestionIndex(int index) {
        return currentQuestion.getAndSet(index);
    }

    // ----------------- players -------------------

    /**
     * Live roster. Callers must hold the players write lock to modify it or its entries.
     */
    public List<Player> getPlayers() {
        playersLock.requireHeld();
        return players;
    }

    public Optional<Player> findPlayer(String name) {
        playersLock.requireHeld();
        return players.stream()
                .filter(p -> p.getName().equals(name))
                .findFirst();
    }

    public List<PlayerSnapshot> snapshotPlayers() {
        playersLock.requireHeld();
        return players.stream()
                .map(Player::snapshot)
                .collect(Collectors.toUnmodifiableList());
    }

    // ----------------- events -------------------

    /**
     * Appends an event with the next id (0 for the first one).
     */
    public GameEvent appendEvent(EventPayload payload) {
        eventsLock.requireWriteHeld();
        long id = events.isEmpty() ? 0 : events.get(events.size() - 1).getId() + 1;
        GameEvent event = GameEvent.of(id, payload);
        events.add(event);
        return event;
    }

    public List<GameEvent> getEvents() {
        eventsLock.requireHeld();
        return List.copyOf(events);
    }
}
