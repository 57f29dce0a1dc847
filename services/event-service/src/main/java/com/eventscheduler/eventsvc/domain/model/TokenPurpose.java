package com.eventscheduler.eventsvc.domain.model;

/**
 * A token authorizes exactly one kind of account transition.
 */
public enum TokenPurpose {
    EMAIL_VERIFICATION,
    PASSWORD_RESET
}
