package com.clout.gameshow.exception;

public enum ErrorKind {
    /** Malformed or out-of-range argument. */
    INVALID_INPUT,
    /** Referenced player does not exist. */
    NOT_FOUND,
    /** Operation not legal in the current phase. */
    PHASE_MISMATCH,
    /** Fifty-fifty requested with no jokers left. */
    NO_JOKERS_LEFT,
    /** Question source unreadable or malformed. */
    LOAD_FAILURE
}
