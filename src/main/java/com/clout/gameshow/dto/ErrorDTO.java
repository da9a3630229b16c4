package com.clout.gameshow.dto;

import com.clout.gameshow.exception.ErrorKind;
import lombok.Value;

@Value
public class ErrorDTO {
    ErrorKind error;
    String message;
}
