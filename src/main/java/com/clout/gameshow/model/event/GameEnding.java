package com.clout.gameshow.model.event;

import com.clout.gameshow.model.PlayerSnapshot;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;

import java.util.List;

@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class GameEnding implements EventPayload {
    List<PlayerSnapshot> playerData;

    @Override
    public String eventName() {
        return EventNames.GAME_ENDING;
    }
}
