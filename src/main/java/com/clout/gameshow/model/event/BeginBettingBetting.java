package com.clout.gameshow.model.event;

import com.clout.gameshow.model.QuestionType;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;

/**
 * Opens the betting round. Only the category is revealed; the prompt follows in
 * {@link BeginBettingAnswering}.
 */
@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BeginBettingBetting implements EventPayload {
    QuestionType questionType;
    int currentQuestion;
    String category;

    @Override
    public String eventName() {
        return EventNames.BEGIN_BETTING_BETTING;
    }
}
