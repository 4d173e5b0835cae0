package com.gt.vsrs.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown for network or storage failures while talking to the data API. Safe to retry.
@ResponseStatus(value = HttpStatus.SERVICE_UNAVAILABLE)
public class TransientException extends RuntimeException {

    public TransientException(String msg) {
        super(msg);
    }

    public TransientException(String msg, Exception ex) {
        super(msg, ex);
    }
}
