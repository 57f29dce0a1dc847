package com.eventscheduler.eventsvc.shared.exception;

/**
 * Base sealed exception for all Event Service domain errors.
 * Each subtype carries a stable error code and the HTTP status it maps to.
 */
public sealed abstract class EventServiceException extends RuntimeException
        permits EmailExistsException, InvalidTokenException, ExpiredTokenException,
                AlreadyUsedException, UserNotFoundException, RateLimitedException,
                ValidationException, InvalidCredentialsException, ForbiddenException,
                UserNotVerifiedException, EventNotFoundException, PastEventException,
                AlreadyJoinedException, CapacityExceededException, NotAParticipantException {

    protected EventServiceException(String message) {
        super(message);
    }

    protected EventServiceException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String getErrorCode();
    public abstract int getHttpStatus();
}
