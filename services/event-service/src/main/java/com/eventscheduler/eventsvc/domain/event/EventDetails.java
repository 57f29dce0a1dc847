package com.eventscheduler.eventsvc.domain.event;

import com.eventscheduler.eventsvc.domain.model.Event;

/**
 * An event together with whether the caller takes part in it; {@code joined} is null for anonymous callers.
 */
public record EventDetails(Event event, Boolean joined) {
}
