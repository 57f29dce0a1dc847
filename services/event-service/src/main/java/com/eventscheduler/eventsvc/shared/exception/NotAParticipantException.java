package com.eventscheduler.eventsvc.shared.exception;

public final class NotAParticipantException extends EventServiceException {
    
    public NotAParticipantException() {
        super("User is not a participant of this event");
    }

    @Override
    public String getErrorCode() {
        return "NOT_A_PARTICIPANT";
    }

    @Override
    public int getHttpStatus() {
        return 404;
    }
}
