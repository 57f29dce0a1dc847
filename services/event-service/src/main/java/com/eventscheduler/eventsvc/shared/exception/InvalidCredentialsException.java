package com.eventscheduler.eventsvc.shared.exception;

public final class InvalidCredentialsException extends EventServiceException {
    
    public InvalidCredentialsException() {
        super("Invalid email or password");
    }

    @Override
    public String getErrorCode() {
        return "INVALID_CREDENTIALS";
    }

    @Override
    public int getHttpStatus() {
        return 401;
    }
}
