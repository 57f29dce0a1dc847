package com.eventscheduler.eventsvc.domain.ratelimit;

/**
 * What the limiter does when the shared counter store cannot be reached.
 */
public enum FailureMode {
    /** Admit the request and log the outage. */
    FAIL_OPEN,
    /** Reject the request until the current window ends. */
    FAIL_CLOSED,
    /** Count the request in the in-process store instead. */
    LOCAL_FALLBACK
}
