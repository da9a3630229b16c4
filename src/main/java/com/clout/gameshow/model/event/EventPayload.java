package com.clout.gameshow.model.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Typed body of a {@link GameEvent}. Serialized wrapped in an object keyed by the event name,
 * e.g. {@code {"ShowResults": {...}}}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(value = BeginNormalAnswering.class, name = EventNames.BEGIN_NORMAL_ANSWERING),
        @JsonSubTypes.Type(value = BeginBettingBetting.class, name = EventNames.BEGIN_BETTING_BETTING),
        @JsonSubTypes.Type(value = BeginBettingAnswering.class, name = EventNames.BEGIN_BETTING_ANSWERING),
        @JsonSubTypes.Type(value = BeginEstimationAnswering.class, name = EventNames.BEGIN_ESTIMATION_ANSWERING),
        @JsonSubTypes.Type(value = BeginVersusSelecting.class, name = EventNames.BEGIN_VERSUS_SELECTING),
        @JsonSubTypes.Type(value = BeginVersusAnswering.class, name = EventNames.BEGIN_VERSUS_ANSWERING),
        @JsonSubTypes.Type(value = ShowResults.class, name = EventNames.SHOW_RESULTS),
        @JsonSubTypes.Type(value = GameEnding.class, name = EventNames.GAME_ENDING)
})
public interface EventPayload {

    String eventName();
}
