package com.eventscheduler.eventsvc.shared.exception;

public final class UserNotFoundException extends EventServiceException {
    
    public UserNotFoundException() {
        super("User not found");
    }

    @Override
    public String getErrorCode() {
        return "USER_NOT_FOUND";
    }

    @Override
    public int getHttpStatus() {
        return 404;
    }
}
