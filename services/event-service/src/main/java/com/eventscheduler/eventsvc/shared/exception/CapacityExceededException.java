package com.eventscheduler.eventsvc.shared.exception;

public final class CapacityExceededException extends EventServiceException {
    
    public CapacityExceededException() {
        super("Event has reached its capacity");
    }

    @Override
    public String getErrorCode() {
        return "CAPACITY_EXCEEDED";
    }

    @Override
    public int getHttpStatus() {
        return 409;
    }
}
