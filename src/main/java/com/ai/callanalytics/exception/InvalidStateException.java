package com.ai.callanalytics.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class InvalidStateException extends CallStoreException {

    public InvalidStateException(String message) {
        super(message);
    }
}
