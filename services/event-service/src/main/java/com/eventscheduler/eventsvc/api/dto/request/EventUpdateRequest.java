package com.eventscheduler.eventsvc.api.dto.request;

import java.time.Instant;

/**
 * Partial update; omitted fields keep their value.
 */
public record EventUpdateRequest(
        String title,
        String description,
        Instant startsAt,
        Instant endsAt,
        Integer capacity
) {}
