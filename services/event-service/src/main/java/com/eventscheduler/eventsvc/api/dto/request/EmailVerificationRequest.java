package com.eventscheduler.eventsvc.api.dto.request;

import jakarta.validation.constraints.NotBlank;

public record EmailVerificationRequest(
        @NotBlank(message = "Token is required")
        String token
) {}
