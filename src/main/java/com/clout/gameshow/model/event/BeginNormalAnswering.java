package com.clout.gameshow.model.event;

import com.clout.gameshow.model.QuestionType;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;

import java.util.List;

@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BeginNormalAnswering implements EventPayload {
    QuestionType questionType;
    int currentQuestion;
    String category;
    String question;
    List<String> answers;

    @Override
    public String eventName() {
        return EventNames.BEGIN_NORMAL_ANSWERING;
    }
}
