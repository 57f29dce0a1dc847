package com.eventscheduler.eventsvc.domain.verification;

/**
 * Recipient and single-use link of an account email.
 */
public record AccountLink(String email, String url) {
}
