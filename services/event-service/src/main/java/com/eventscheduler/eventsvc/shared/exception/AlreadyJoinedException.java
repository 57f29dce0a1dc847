package com.eventscheduler.eventsvc.shared.exception;

public final class AlreadyJoinedException extends EventServiceException {
    
    public AlreadyJoinedException() {
        super("User has already joined this event");
    }

    @Override
    public String getErrorCode() {
        return "ALREADY_JOINED";
    }

    @Override
    public int getHttpStatus() {
        return 409;
    }
}
