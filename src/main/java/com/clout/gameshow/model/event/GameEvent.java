package com.clout.gameshow.model.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;

/**
 * One entry of the append-only event log.
 */
@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class GameEvent {
    long id;
    String eventName;
    EventPayload event;

    public static GameEvent of(long id, EventPayload payload) {
        return new GameEvent(id, payload.eventName(), payload);
    }
}
