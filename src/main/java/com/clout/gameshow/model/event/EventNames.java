package com.clout.gameshow.model.event;

/**
 * Event names as the frontend expects them on the wire.
 */
public final class EventNames {

    public static final String BEGIN_NORMAL_ANSWERING = "BeginNormalQAnswering";
    public static final String BEGIN_BETTING_BETTING = "BeginBettingQBetting";
    public static final String BEGIN_BETTING_ANSWERING = "BeginBettingQAnswering";
    public static final String BEGIN_ESTIMATION_ANSWERING = "BeginEstimationQAnswering";
    public static final String BEGIN_VERSUS_SELECTING = "BeginVersusQSelecting";
    public static final String BEGIN_VERSUS_ANSWERING = "BeginVersusQAnswering";
    public static final String SHOW_RESULTS = "ShowResults";
    public static final String GAME_ENDING = "GameEnding";

    private EventNames() {
    }
}
