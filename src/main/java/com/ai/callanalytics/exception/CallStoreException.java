package com.ai.callanalytics.exception;

/**
 * Base type for failures surfaced by the conversation store. All subtypes are unchecked
 * and reach the caller synchronously; nothing in this service retries them.
 */
public abstract class CallStoreException extends RuntimeException {

    protected CallStoreException(String message) {
        super(message);
    }

    protected CallStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
