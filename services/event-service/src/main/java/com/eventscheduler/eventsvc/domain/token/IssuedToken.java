package com.eventscheduler.eventsvc.domain.token;

import com.eventscheduler.eventsvc.domain.model.TokenPurpose;

import java.time.Instant;

/**
 * A freshly issued token. {@code rawValue} is only ever handed to the user; it is not stored.
 */
public record IssuedToken(String rawValue, TokenPurpose purpose, Instant expiresAt) {

    @Override
    public String toString() {
        return "IssuedToken[purpose=" + purpose + ", expiresAt=" + expiresAt + "]";
    }
}
