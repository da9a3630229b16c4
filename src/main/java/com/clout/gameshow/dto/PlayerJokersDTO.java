package com.clout.gameshow.dto;

import lombok.Value;

@Value
public class PlayerJokersDTO {
    String name;
    int jokers;
}
