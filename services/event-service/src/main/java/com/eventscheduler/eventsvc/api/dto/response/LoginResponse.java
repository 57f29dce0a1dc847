package com.eventscheduler.eventsvc.api.dto.response;

import java.time.Instant;
import java.util.UUID;

public record LoginResponse(
        String accessToken,
        String tokenType,
        Instant expiresAt,
        UUID userId,
        boolean verified
) {}
