package com.eventscheduler.eventsvc.domain.token;

import com.eventscheduler.eventsvc.domain.model.User;

/**
 * Result of validating a raw token. The owner is present for VALID and EXPIRED results.
 */
public record TokenValidation(TokenStatus status, User owner) {

    public static TokenValidation valid(User owner) {
        return new TokenValidation(TokenStatus.VALID, owner);
    }

    public static TokenValidation expired(User owner) {
        return new TokenValidation(TokenStatus.EXPIRED, owner);
    }

    public static TokenValidation consumed() {
        return new TokenValidation(TokenStatus.CONSUMED, null);
    }

    public static TokenValidation notFound() {
        return new TokenValidation(TokenStatus.NOT_FOUND, null);
    }

    public boolean isValid() {
        return status == TokenStatus.VALID;
    }
}
