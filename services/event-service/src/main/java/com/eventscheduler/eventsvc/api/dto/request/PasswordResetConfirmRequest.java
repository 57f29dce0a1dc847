package com.eventscheduler.eventsvc.api.dto.request;

import jakarta.validation.constraints.NotBlank;

public record PasswordResetConfirmRequest(
        @NotBlank(message = "Token is required")
        String token,

        @NotBlank(message = "Password is required")
        String password,

        @NotBlank(message = "Password confirmation is required")
        String confirmPassword
) {
    @Override
    public String toString() {
        return "PasswordResetConfirmRequest[]";
    }
}
