package com.eventscheduler.eventsvc.domain.model;

public enum TaskKind {
    SEND_VERIFICATION_EMAIL,
    SEND_PASSWORD_RESET_EMAIL,
    RECOUNT_PARTICIPANTS,
    PURGE_EXPIRED_TOKENS
}
