package com.eventscheduler.eventsvc.infrastructure.logging;

import java.time.Instant;
import java.util.Map;

/**
 * Suspicious or security relevant request: failed logins, rate limit hits. IP and email are masked when written.
 */
public record SecurityEvent(
        String eventType,
        String ipAddress,
        String email,
        String correlationId,
        String description,
        Map<String, String> metadata,
        Instant timestamp
) {
    public static SecurityEvent of(String eventType, String ipAddress, String email,
                                   String correlationId, String description) {
        return new SecurityEvent(eventType, ipAddress, email, correlationId, description, Map.of(), Instant.now());
    }
}
