package com.pushit.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class JobAcceptanceException extends RuntimeException {

    public JobAcceptanceException(String message) {
        super(message);
    }
}
