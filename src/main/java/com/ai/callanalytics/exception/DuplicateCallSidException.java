package com.ai.callanalytics.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class DuplicateCallSidException extends CallStoreException {

    private final String callSid;

    public DuplicateCallSidException(String callSid) {
        super("Conversation already exists for callSid=" + callSid);
        this.callSid = callSid;
    }

    public DuplicateCallSidException(String callSid, Throwable cause) {
        super("Conversation already exists for callSid=" + callSid, cause);
        this.callSid = callSid;
    }

    public String getCallSid() {
        return callSid;
    }
}
