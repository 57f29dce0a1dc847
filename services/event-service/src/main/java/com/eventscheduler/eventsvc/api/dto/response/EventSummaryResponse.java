package com.eventscheduler.eventsvc.api.dto.response;

import com.eventscheduler.eventsvc.domain.model.Event;

import java.time.Instant;

public record EventSummaryResponse(
        String slug,
        String title,
        String description,
        Instant startsAt,
        Instant endsAt,
        Integer capacity,
        int participantsCount
) {
    public static EventSummaryResponse from(Event event) {
        return new EventSummaryResponse(
                event.getSlug(),
                event.shortTitle(),
                event.shortDescription(),
                event.getStartsAt(),
                event.getEndsAt(),
                event.getCapacity(),
                event.getParticipantsCount());
    }
}
