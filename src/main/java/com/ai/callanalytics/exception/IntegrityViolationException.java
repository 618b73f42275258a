package com.ai.callanalytics.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Referential or constraint failure reported by the database itself.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class IntegrityViolationException extends CallStoreException {

    public IntegrityViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
