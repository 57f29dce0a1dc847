package com.eventscheduler.eventsvc.domain.event;

import java.time.Instant;

/**
 * Event fields supplied by a caller. On update, null fields are left unchanged.
 */
public record EventDraft(String title, String description, Instant startsAt, Instant endsAt, Integer capacity) {
}
