package com.eventscheduler.eventsvc.shared.exception;

public final class InvalidTokenException extends EventServiceException {
    
    public InvalidTokenException() {
        super("Invalid token");
    }

    @Override
    public String getErrorCode() {
        return "INVALID_TOKEN";
    }

    @Override
    public int getHttpStatus() {
        return 400;
    }
}
