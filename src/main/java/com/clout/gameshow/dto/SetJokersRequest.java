package com.clout.gameshow.dto;

import lombok.Data;

@Data
public class SetJokersRequest {

    private String name;
    private int jokers;
}
