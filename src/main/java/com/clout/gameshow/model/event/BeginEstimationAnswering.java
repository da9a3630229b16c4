package com.clout.gameshow.model.event;

import com.clout.gameshow.model.QuestionType;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;

@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BeginEstimationAnswering implements EventPayload {
    QuestionType questionType;
    int currentQuestion;
    String category;
    String question;

    @Override
    public String eventName() {
        return EventNames.BEGIN_ESTIMATION_ANSWERING;
    }
}
