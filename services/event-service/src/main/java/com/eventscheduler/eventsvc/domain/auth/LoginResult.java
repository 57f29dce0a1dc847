package com.eventscheduler.eventsvc.domain.auth;

import java.time.Instant;
import java.util.UUID;

public record LoginResult(UUID userId, String accessToken, Instant expiresAt, boolean verified) {

    @Override
    public String toString() {
        return "LoginResult[userId=" + userId + ", expiresAt=" + expiresAt + "]";
    }
}
