package com.gt.vsrs.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown by any remote-touching operation that is called without a valid session
@ResponseStatus(value = HttpStatus.UNAUTHORIZED)
public class AuthRequiredException extends RuntimeException {

    public AuthRequiredException(String msg) {
        super(msg);
    }

    public AuthRequiredException(String msg, Exception ex) {
        super(msg, ex);
    }
}
