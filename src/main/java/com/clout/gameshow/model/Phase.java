package com.clout.gameshow.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Where the current question is in its pipeline, together with the flag telling
 * whether the next poll may advance it. Stage and readiness travel as one immutable
 * value so they can never be observed out of step.
 */
@Getter
@EqualsAndHashCode
public final class Phase {

    public enum Stage {
        RESULTS("Results"),
        NORMAL_ANSWERING("NormalAnswering"),
        BETTING_BETTING("BettingBetting"),
        BETTING_ANSWERING("BettingAnswering"),
        ESTIMATION_ANSWERING("EstimationAnswering"),
        VERSUS_SELECTING("VersusSelecting"),
        VERSUS_ANSWERING("VersusAnswering"),
        GAME_ENDING("GameEnding");

        private final String label;

        Stage(String label) {
            this.label = label;
        }

        public boolean isAnswering() {
            return this == NORMAL_ANSWERING
                    || this == BETTING_ANSWERING
                    || this == ESTIMATION_ANSWERING
                    || this == VERSUS_ANSWERING;
        }

        /**
         * Question type settled when this answering stage completes.
         */
        public QuestionType settledType() {
            return switch (this) {
                case NORMAL_ANSWERING -> QuestionType.NORMAL;
                case BETTING_ANSWERING -> QuestionType.BETTING;
                case ESTIMATION_ANSWERING -> QuestionType.ESTIMATION;
                case VERSUS_ANSWERING -> QuestionType.VERSUS;
                default -> throw new IllegalStateException(label + " is not an answering stage");
            };
        }
    }

    public static final Phase GAME_ENDING = new Phase(Stage.GAME_ENDING, false);

    private final Stage stage;
    private final boolean ready;

    private Phase(Stage stage, boolean ready) {
        this.stage = stage;
        this.ready = ready;
    }

    public static Phase waiting(Stage stage) {
        return stage == Stage.GAME_ENDING ? GAME_ENDING : new Phase(stage, false);
    }

    public static Phase ready(Stage stage) {
        if (stage == Stage.GAME_ENDING) {
            throw new IllegalArgumentException("GameEnding carries no readiness");
        }
        return new Phase(stage, true);
    }

    public Phase asReady() {
        return ready(stage);
    }

    /**
     * True when this is the given stage and still waiting for player actions.
     */
    public boolean isWaiting(Stage expected) {
        return stage == expected && !ready;
    }

    public boolean isGameEnding() {
        return stage == Stage.GAME_ENDING;
    }

    @JsonValue
    @Override
    public String toString() {
        if (isGameEnding()) {
            return stage.label;
        }
        return stage.label + "(" + ready + ")";
    }
}
