package com.eventscheduler.eventsvc.domain.registration;

import java.util.UUID;

public record RegistrationResult(UUID userId, String slug, boolean verified) {
}
