package com.clout.gameshow.dto;

import com.clout.gameshow.model.Phase;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;

@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class GameStateDTO {
    Phase phase;
    int currentQuestion;
    int questionCount;
}
