package com.clout.gameshow.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PlayerSnapshot {
    String name;
    int jokers;
    long money;
    long moneyBet;
    String vsPlayer;
    int answer;
}
