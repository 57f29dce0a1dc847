package com.eventscheduler.eventsvc.shared.exception;

public final class UserNotVerifiedException extends EventServiceException {
    
    public UserNotVerifiedException() {
        super("User email is not verified");
    }

    @Override
    public String getErrorCode() {
        return "USER_NOT_VERIFIED";
    }

    @Override
    public int getHttpStatus() {
        return 403;
    }
}
