package com.clout.gameshow.dto;

import lombok.Data;

@Data
public class GiveMoneyRequest {

    private String name;
    private long money; // negative to take money away
}
