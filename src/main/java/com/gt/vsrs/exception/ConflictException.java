package com.gt.vsrs.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when a grade on the same record is already in flight or the record changed underneath it.
// Callers reload the record and retry.
@ResponseStatus(value = HttpStatus.CONFLICT)
public class ConflictException extends RuntimeException {

    public ConflictException(String msg) {
        super(msg);
    }

    public ConflictException(String msg, Exception ex) {
        super(msg, ex);
    }
}
