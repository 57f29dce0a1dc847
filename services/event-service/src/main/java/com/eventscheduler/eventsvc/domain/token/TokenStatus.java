package com.eventscheduler.eventsvc.domain.token;

public enum TokenStatus {
    VALID,
    EXPIRED,
    CONSUMED,
    NOT_FOUND
}
