package com.clout.gameshow.model.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;

import java.util.List;

@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BeginBettingAnswering implements EventPayload {
    String question;
    List<String> answers;

    @Override
    public String eventName() {
        return EventNames.BEGIN_BETTING_ANSWERING;
    }
}
