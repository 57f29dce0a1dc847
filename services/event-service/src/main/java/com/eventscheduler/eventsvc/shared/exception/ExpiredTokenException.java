package com.eventscheduler.eventsvc.shared.exception;

public final class ExpiredTokenException extends EventServiceException {
    
    public ExpiredTokenException() {
        super("Token has expired");
    }

    @Override
    public String getErrorCode() {
        return "EXPIRED_TOKEN";
    }

    @Override
    public int getHttpStatus() {
        return 400;
    }
}
