package com.eventscheduler.eventsvc.shared.exception;

public final class EmailExistsException extends EventServiceException {
    
    public EmailExistsException() {
        super("Email already exists");
    }

    @Override
    public String getErrorCode() {
        return "EMAIL_EXISTS";
    }

    @Override
    public int getHttpStatus() {
        return 409;
    }
}
