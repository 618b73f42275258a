package com.ai.callanalytics.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class ResourceNotFoundException extends CallStoreException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public static ResourceNotFoundException conversation(Long id) {
        return new ResourceNotFoundException("Conversation not found: id=" + id);
    }

    public static ResourceNotFoundException conversation(String callSid) {
        return new ResourceNotFoundException("Conversation not found: callSid=" + callSid);
    }

    public static ResourceNotFoundException script(Long id) {
        return new ResourceNotFoundException("Follow-up script not found: id=" + id);
    }

    public static ResourceNotFoundException analysis(Long conversationId) {
        return new ResourceNotFoundException("Analysis not found for conversation id=" + conversationId);
    }
}
