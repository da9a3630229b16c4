package com.clout.gameshow.model;

import lombok.Getter;
import lombok.Setter;

/**
 * Live player record held by the store. Only touched while the players lock is held.
 */
@Getter
@Setter
public class Player {

    private final String name;
    private int jokers;
    private long money;

    // zero / empty mean "nothing submitted yet" for the current question
    private long moneyBet;
    private String vsPlayer = "";
    private int answer;

    public Player(String name, int jokers, long money) {
        this.name = name;
        this.jokers = jokers;
        this.money = money;
    }

    public void resetRound() {
        moneyBet = 0;
        vsPlayer = "";
        answer = 0;
    }

    public boolean hasBet() {
        return moneyBet >= 1;
    }

    public boolean hasOpponent() {
        return !vsPlayer.isEmpty();
    }

    public boolean hasAnswered() {
        return answer >= 1;
    }

    public PlayerSnapshot snapshot() {
        return PlayerSnapshot.builder()
                .name(name)
                .jokers(jokers)
                .money(money)
                .moneyBet(moneyBet)
                .vsPlayer(vsPlayer)
                .answer(answer)
                .build();
    }
}
