package com.eventscheduler.eventsvc.domain.model;

public enum UserStatus {
    ACTIVE,
    DISABLED
}
