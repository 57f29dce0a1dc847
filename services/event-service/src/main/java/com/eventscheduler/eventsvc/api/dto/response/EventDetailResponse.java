package com.eventscheduler.eventsvc.api.dto.response;

import com.eventscheduler.eventsvc.domain.event.EventDetails;
import com.eventscheduler.eventsvc.domain.model.Event;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventDetailResponse(
        String slug,
        String title,
        String description,
        Instant startsAt,
        Instant endsAt,
        Integer capacity,
        int participantsCount,
        String creator,
        Instant createdAt,
        Instant updatedAt,
        Boolean joined
) {
    public static EventDetailResponse from(Event event, Boolean joined) {
        return new EventDetailResponse(
                event.getSlug(),
                event.getTitle(),
                event.getDescription(),
                event.getStartsAt(),
                event.getEndsAt(),
                event.getCapacity(),
                event.getParticipantsCount(),
                event.getCreator().getSlug(),
                event.getCreatedAt(),
                event.getUpdatedAt(),
                joined);
    }

    public static EventDetailResponse from(EventDetails details) {
        return from(details.event(), details.joined());
    }
}
