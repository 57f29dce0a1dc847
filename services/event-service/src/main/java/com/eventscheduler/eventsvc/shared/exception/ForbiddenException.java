package com.eventscheduler.eventsvc.shared.exception;

/**
 * Raised when the caller acts on a resource it does not own.
 */
public final class ForbiddenException extends EventServiceException {

    public ForbiddenException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "FORBIDDEN";
    }

    @Override
    public int getHttpStatus() {
        return 403;
    }
}
