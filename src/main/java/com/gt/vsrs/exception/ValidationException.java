package com.gt.vsrs.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown for malformed input, e.g. a snapshot row with an unknown foreign key. Nothing is applied.
@ResponseStatus(value = HttpStatus.BAD_REQUEST)
public class ValidationException extends RuntimeException {

    public ValidationException(String msg) {
        super(msg);
    }

    public ValidationException(String msg, Exception ex) {
        super(msg, ex);
    }
}
