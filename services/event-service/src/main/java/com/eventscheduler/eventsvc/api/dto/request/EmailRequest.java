package com.eventscheduler.eventsvc.api.dto.request;

import jakarta.validation.constraints.NotBlank;

/**
 * Body of the endpoints that mail a link to an address: resend verification, request password reset.
 */
public record EmailRequest(
        @NotBlank(message = "Email is required")
        String email
) {}
