package com.eventscheduler.eventsvc.domain.event;

import java.util.Locale;
import java.util.Optional;

public enum EventListScope {
    /** Upcoming events of every creator. */
    ALL,
    /** Every event of the calling user, past ones included. */
    CREATOR;

    public static Optional<EventListScope> parse(String value) {
        if (value == null) {
            return Optional.of(ALL);
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
