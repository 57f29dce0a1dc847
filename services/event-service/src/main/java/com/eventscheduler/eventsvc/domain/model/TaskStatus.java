package com.eventscheduler.eventsvc.domain.model;

/**
 * PENDING -> DISPATCHED -> COMPLETED, or FAILED once retries are exhausted.
 */
public enum TaskStatus {
    PENDING,
    DISPATCHED,
    COMPLETED,
    FAILED
}
