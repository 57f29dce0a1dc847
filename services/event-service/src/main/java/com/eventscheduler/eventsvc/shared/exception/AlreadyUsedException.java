package com.eventscheduler.eventsvc.shared.exception;

public final class AlreadyUsedException extends EventServiceException {
    
    public AlreadyUsedException() {
        super("Token has already been used");
    }

    @Override
    public String getErrorCode() {
        return "ALREADY_USED";
    }

    @Override
    public int getHttpStatus() {
        return 400;
    }
}
