package com.clout.gameshow.service;

import com.clout.gameshow.model.Phase;
import com.clout.gameshow.model.Player;
import com.clout.gameshow.model.Question;
import com.clout.gameshow.model.event.BeginBettingAnswering;
import com.clout.gameshow.model.event.BeginBettingBetting;
import com.clout.gameshow.model.event.BeginEstimationAnswering;
import com.clout.gameshow.model.event.BeginNormalAnswering;
import com.clout.gameshow.model.event.BeginVersusAnswering;
import com.clout.gameshow.model.event.BeginVersusSelecting;
import com.clout.gameshow.model.event.EventPayload;
import com.clout.gameshow.model.event.GameEnding;
import com.clout.gameshow.model.event.GameEvent;
import com.clout.gameshow.model.event.ShowResults;
import com.clout.gameshow.store.GameshowStore;
import com.clout.gameshow.store.OrderedLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Moves the game forward. Nothing advances on its own: every transition happens
 * when an observer polls the event log and finds the current phase ready.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdvancementService {

    private final GameshowStore store;
    private final ScoringEngine scoringEngine;

    /**
     * Advances the phase if it is ready, then returns the whole event log.
     */
    public List<GameEvent> pollAndAdvance() {
        if (peekReady()) {
            advance();
        }
        return events();
    }

    public boolean peekReady() {
        try (OrderedLock.Handle phaseHandle = store.phaseLock().read()) {
            return store.getPhase().isReady();
        }
    }

    /**
     * Performs at most one transition. Readiness is checked again under the phase
     * write lock, so concurrent callers cannot advance the same phase twice.
     *
     * @return true if a transition happened
     */
    public boolean advance() {
        try (OrderedLock.Handle phaseHandle = store.phaseLock().write()) {
            Phase current = store.getPhase();
            if (!current.isReady()) {
                return false;
            }

            Phase next = switch (current.getStage()) {
                case RESULTS -> beginNextQuestion();
                case BETTING_BETTING -> revealQuestion(Phase.Stage.BETTING_ANSWERING);
                case VERSUS_SELECTING -> revealQuestion(Phase.Stage.VERSUS_ANSWERING);
                case NORMAL_ANSWERING, BETTING_ANSWERING, ESTIMATION_ANSWERING, VERSUS_ANSWERING ->
                        settle(current.getStage());
                case GAME_ENDING -> throw new IllegalStateException("GameEnding is never ready");
            };

            store.setPhase(next);
            log.info("Phase {} -> {}", current, next);
            return true;
        }
    }

    public List<GameEvent> events() {
        try (OrderedLock.Handle eventsHandle = store.eventsLock().read()) {
            return store.getEvents();
        }
    }

    // ----------------- transitions (phase write lock held) -------------------

    private Phase beginNextQuestion() {
        int number = store.nextQuestionIndex();
        try (OrderedLock.Handle questionsHandle = store.questionsLock().read()) {
            List<Question> questions = store.getQuestions();

            if (number > questions.size()) {
                try (OrderedLock.Handle playersHandle = store.playersLock().read()) {
                    GameEnding ending = new GameEnding(store.snapshotPlayers());
                    append(ending);
                }
                log.info("Game over after {} questions", questions.size());
                return Phase.GAME_ENDING;
            }

            Question question = questions.get(number - 1);
            try (OrderedLock.Handle playersHandle = store.playersLock().write()) {
                store.getPlayers().forEach(Player::resetRound);
                append(beginEvent(question, number));
            }
            log.info("Question {} ({}) begins", number, question.getQuestionType());
            return Phase.waiting(question.getQuestionType().firstStage());
        }
    }

    private Phase revealQuestion(Phase.Stage answeringStage) {
        try (OrderedLock.Handle questionsHandle = store.questionsLock().read()) {
            Question question = store.getCurrentQuestion();
            EventPayload payload = answeringStage == Phase.Stage.BETTING_ANSWERING
                    ? new BeginBettingAnswering(question.getQuestion(), question.getAnswers())
                    : new BeginVersusAnswering(question.getQuestion(), question.getAnswers());
            append(payload);
        }
        return Phase.waiting(answeringStage);
    }

    private Phase settle(Phase.Stage answeringStage) {
        try (OrderedLock.Handle questionsHandle = store.questionsLock().read()) {
            int correctAnswer = store.getCurrentQuestion().getCorrectAnswer();
            try (OrderedLock.Handle playersHandle = store.playersLock().write()) {
                ShowResults results = scoringEngine.settle(
                        answeringStage.settledType(), correctAnswer, store.getPlayers());
                append(results);
            }
        }
        return Phase.waiting(Phase.Stage.RESULTS);
    }

    private EventPayload beginEvent(Question question, int number) {
        return switch (question.getQuestionType()) {
            case NORMAL -> new BeginNormalAnswering(question.getQuestionType(), number,
                    question.getCategory(), question.getQuestion(), question.getAnswers());
            case BETTING -> new BeginBettingBetting(question.getQuestionType(), number, question.getCategory());
            case ESTIMATION -> new BeginEstimationAnswering(question.getQuestionType(), number,
                    question.getCategory(), question.getQuestion());
            case VERSUS -> new BeginVersusSelecting(question.getQuestionType(), number, question.getCategory());
        };
    }

    private void append(EventPayload payload) {
        try (OrderedLock.Handle eventsHandle = store.eventsLock().write()) {
            GameEvent event = store.appendEvent(payload);
            log.debug("Event {} {}", event.getId(), event.getEventName());
        }
    }
}
