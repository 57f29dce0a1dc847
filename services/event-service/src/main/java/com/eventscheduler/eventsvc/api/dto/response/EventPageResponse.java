package com.eventscheduler.eventsvc.api.dto.response;

import com.eventscheduler.eventsvc.domain.model.Event;
import org.springframework.data.domain.Page;

import java.util.List;

public record EventPageResponse(
        List<EventSummaryResponse> items,
        int page,
        int size,
        long totalElements,
        int totalPages
) {
    public static EventPageResponse from(Page<Event> page) {
        return new EventPageResponse(
                page.getContent().stream().map(EventSummaryResponse::from).toList(),
                page.getNumber(),
                page.getSize(),
                page.getTotalElements(),
                page.getTotalPages());
    }
}
