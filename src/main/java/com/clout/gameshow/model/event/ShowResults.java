package com.clout.gameshow.model.event;

import com.clout.gameshow.model.PlayerSnapshot;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;

import java.util.List;

/**
 * Settlement of one question: the roster before and after scoring.
 */
@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ShowResults implements EventPayload {
    int correctAnswer;
    List<PlayerSnapshot> previousPlayerData;
    List<PlayerSnapshot> playerData;

    @Override
    public String eventName() {
        return EventNames.SHOW_RESULTS;
    }
}
