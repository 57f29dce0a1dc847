package com.eventscheduler.eventsvc.api.dto.request;

import jakarta.validation.constraints.NotBlank;

public record ProfileUpdateRequest(
        @NotBlank(message = "Email is required")
        String email
) {}
