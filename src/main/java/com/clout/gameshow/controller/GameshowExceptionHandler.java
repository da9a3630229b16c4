package com.clout.gameshow.controller;

import com.clout.gameshow.dto.ErrorDTO;
import com.clout.gameshow.exception.GameshowException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Turns rejected actions into client errors. Phase problems answer 406 so the
 * frontend can tell "not now" apart from "bad request".
 */
@Slf4j
@RestControllerAdvice
public class GameshowExceptionHandler {

    @ExceptionHandler(GameshowException.class)
    public ResponseEntity<ErrorDTO> handle(GameshowException e) {
        HttpStatus status = switch (e.getKind()) {
            case INVALID_INPUT, NOT_FOUND, LOAD_FAILURE -> HttpStatus.BAD_REQUEST;
            case PHASE_MISMATCH, NO_JOKERS_LEFT -> HttpStatus.NOT_ACCEPTABLE;
        };
        log.debug("Rejected request: {} {}", e.getKind(), e.getMessage());
        return ResponseEntity.status(status).body(new ErrorDTO(e.getKind(), e.getMessage()));
    }
}
