package com.eventscheduler.eventsvc.api.dto.response;

import java.util.UUID;

public record UserRegistrationResponse(UUID userId, String slug, boolean verified) {}
