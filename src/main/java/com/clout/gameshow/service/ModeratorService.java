package com.clout.gameshow.service;

import com.clout.gameshow.dto.GameStateDTO;
import com.clout.gameshow.exception.GameshowException;
import com.clout.gameshow.model.Phase;
import com.clout.gameshow.model.Player;
import com.clout.gameshow.model.Question;
import com.clout.gameshow.store.GameshowStore;
import com.clout.gameshow.store.OrderedLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Moderator controls: roster management, forcing stuck phases forward, and
 * choosing which question comes next.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModeratorService {

    private final GameshowStore store;
    private final QuestionLoader questionLoader;

    public void kick(String name) {
        try (OrderedLock.Handle playersHandle = store.playersLock().write()) {
            boolean removed = store.getPlayers().removeIf(p -> p.getName().equals(name));
            if (!removed) {
                throw GameshowException.notFound(name);
            }
        }
        log.info("Player {} was kicked", name);
    }

    /**
     * Adds {@code delta} to a player's balance (negative to take money away).
     *
     * @return the new balance
     */
    public long giveMoney(String name, long delta) {
        try (OrderedLock.Handle playersHandle = store.playersLock().write()) {
            Player player = requirePlayer(name);
            long updated = player.getMoney() + delta;
            if (updated < 0) {
                throw GameshowException.invalidInput("Money of " + name + " would become negative!");
            }
            player.setMoney(updated);
            log.info("Gave {} to {}, balance now {}", delta, name, updated);
            return updated;
        }
    }

    public int setJokers(String name, int jokers) {
        if (jokers < 0) {
            throw GameshowException.invalidInput("jokers must not be negative!");
        }
        try (OrderedLock.Handle playersHandle = store.playersLock().write()) {
            requirePlayer(name).setJokers(jokers);
        }
        log.info("Set jokers of {} to {}", name, jokers);
        return jokers;
    }

    /**
     * Ends betting or opponent selection without waiting for the remaining players.
     */
    public void forceBettingOrSelectingReady() {
        try (OrderedLock.Handle phaseHandle = store.phaseLock().write()) {
            Phase phase = store.getPhase();
            if (!phase.isWaiting(Phase.Stage.BETTING_BETTING) && !phase.isWaiting(Phase.Stage.VERSUS_SELECTING)) {
                log.warn("Rejected forced betting/selecting end in phase {}", phase);
                throw GameshowException.phaseMismatch(
                        "Phase is " + phase + ", not BettingBetting(false) or VersusSelecting(false)!");
            }
            store.setPhase(phase.asReady());
        }
        log.info("Moderator ended betting/selecting");
    }

    /**
     * Ends answering without waiting for the remaining players.
     */
    public void forceAnsweringReady() {
        try (OrderedLock.Handle phaseHandle = store.phaseLock().write()) {
            Phase phase = store.getPhase();
            if (!phase.getStage().isAnswering() || phase.isReady()) {
                log.warn("Rejected forced answering end in phase {}", phase);
                throw GameshowException.phaseMismatch("Phase is " + phase + ", not *Answering(false)!");
            }
            store.setPhase(phase.asReady());
        }
        log.info("Moderator ended answering");
    }

    /**
     * Allows the next poll to start the next question.
     */
    public void requestNextQuestion() {
        try (OrderedLock.Handle phaseHandle = store.phaseLock().write()) {
            Phase phase = store.getPhase();
            if (phase.getStage() != Phase.Stage.RESULTS) {
                log.warn("Rejected next question in phase {}", phase);
                throw GameshowException.phaseMismatch("Phase is " + phase + ", not Results! => Not ready for next question!");
            }
            if (!phase.isReady()) {
                store.setPhase(phase.asReady());
            }
        }
    }

    /**
     * Makes question {@code number} (1-based) the one started by the next advancement.
     *
     * @return the previous question index
     */
    public int jumpToQuestion(int number) {
        try (OrderedLock.Handle phaseHandle = store.phaseLock().write()) {
            requireBetweenQuestions();
            int previous;
            try (OrderedLock.Handle questionsHandle = store.questionsLock().read()) {
                int count = store.getQuestions().size();
                if (number < 1 || number > count) {
                    throw GameshowException.invalidInput(
                            "Number is not a valid question ID (must be 1 - " + count + ")!");
                }
                previous = store.swapQuestionIndex(number - 1);
            }
            store.setPhase(Phase.waiting(Phase.Stage.RESULTS));
            log.info("Next question set to {} (was at {})", number, previous);
            return previous;
        }
    }

    /**
     * Replaces the question list and restarts from the first question.
     */
    public int reloadQuestions(List<Question> questions) {
        try (OrderedLock.Handle phaseHandle = store.phaseLock().write()) {
            requireBetweenQuestions();
            try (OrderedLock.Handle questionsHandle = store.questionsLock().write()) {
                store.replaceQuestions(questions);
                store.swapQuestionIndex(0);
            }
            store.setPhase(Phase.waiting(Phase.Stage.RESULTS));
        }
        log.info("Reloaded {} questions", questions.size());
        return questions.size();
    }

    /**
     * Loads a question file from the questions directory and swaps it in. The file is
     * read before any lock is taken.
     */
    public int reloadQuestions(String filename) {
        try (OrderedLock.Handle phaseHandle = store.phaseLock().read()) {
            requireBetweenQuestions();
        }
        return reloadQuestions(questionLoader.loadByName(filename));
    }

    public GameStateDTO status() {
        try (OrderedLock.Handle phaseHandle = store.phaseLock().read();
             OrderedLock.Handle questionsHandle = store.questionsLock().read()) {
            return new GameStateDTO(store.getPhase(), store.getCurrentQuestionIndex(), store.getQuestions().size());
        }
    }

    // ----------------- helpers -------------------

    private void requireBetweenQuestions() {
        Phase phase = store.getPhase();
        if (!phase.isWaiting(Phase.Stage.RESULTS) && !phase.isGameEnding()) {
            log.warn("Rejected question change in phase {}", phase);
            throw GameshowException.phaseMismatch("Phase is " + phase + ", not Results(false) or GameEnding!");
        }
    }

    private Player requirePlayer(String name) {
        return store.findPlayer(name).orElseThrow(() -> GameshowException.notFound(name));
    }
}
