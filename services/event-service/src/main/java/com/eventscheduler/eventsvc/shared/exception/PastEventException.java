package com.eventscheduler.eventsvc.shared.exception;

/**
 * Events that already took place are frozen.
 */
public final class PastEventException extends EventServiceException {

    public PastEventException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "PAST_EVENT";
    }

    @Override
    public int getHttpStatus() {
        return 409;
    }
}
