package com.clout.gameshow.exception;

/**
 * Rejected game show action. Thrown before the store is modified, so a caller
 * that catches it can treat the action as never having happened.
 */
public class GameshowException extends RuntimeException {

    private final ErrorKind kind;

    public GameshowException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public GameshowException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static GameshowException invalidInput(String message) {
        return new GameshowException(ErrorKind.INVALID_INPUT, message);
    }

    public static GameshowException notFound(String playerName) {
        return new GameshowException(ErrorKind.NOT_FOUND, "Player " + playerName + " was not found!");
    }

    public static GameshowException phaseMismatch(String message) {
        return new GameshowException(ErrorKind.PHASE_MISMATCH, message);
    }

    public static GameshowException noJokersLeft(String playerName) {
        return new GameshowException(ErrorKind.NO_JOKERS_LEFT, "Player " + playerName + " has no jokers left!");
    }

    public static GameshowException loadFailure(String message, Throwable cause) {
        return new GameshowException(ErrorKind.LOAD_FAILURE, message, cause);
    }

    public static GameshowException loadFailure(String message) {
        return new GameshowException(ErrorKind.LOAD_FAILURE, message);
    }

    public ErrorKind getKind() {
        return kind;
    }
}
