package com.eventscheduler.eventsvc.api.dto.response;

import com.eventscheduler.eventsvc.domain.model.User;

import java.time.Instant;
import java.util.UUID;

public record ProfileResponse(
    UUID id,
    String email,
    String slug,
    boolean emailVerified,
    String status,
    Instant createdAt,
    Instant updatedAt
) {
    public static ProfileResponse from(User user) {
        return new ProfileResponse(
                user.getId(),
                user.getEmail(),
                user.getSlug(),
                user.isEmailVerified(),
                user.getStatus().name(),
                user.getCreatedAt(),
                user.getUpdatedAt());
    }
}
