package com.clout.gameshow.dto;

import lombok.Value;

@Value
public class PlayerMoneyDTO {
    String name;
    long money;
}
