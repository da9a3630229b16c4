package com.clout.gameshow.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum QuestionType {

    @JsonProperty("NormalQuestion")
    NORMAL(Phase.Stage.NORMAL_ANSWERING, true),

    @JsonProperty("BettingQuestion")
    BETTING(Phase.Stage.BETTING_BETTING, true),

    // correct_answer is the numeric value to estimate, not an option index
    @JsonProperty("EstimationQuestion")
    ESTIMATION(Phase.Stage.ESTIMATION_ANSWERING, false),

    @JsonProperty("VersusQuestion")
    VERSUS(Phase.Stage.VERSUS_SELECTING, true);

    private final Phase.Stage firstStage;
    private final boolean optionBased;

    QuestionType(Phase.Stage firstStage, boolean optionBased) {
        this.firstStage = firstStage;
        this.optionBased = optionBased;
    }

    /**
     * Stage a question of this type enters when it begins.
     */
    public Phase.Stage firstStage() {
        return firstStage;
    }

    public boolean isOptionBased() {
        return optionBased;
    }
}
