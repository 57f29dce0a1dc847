package com.eventscheduler.eventsvc.api.controller;

import com.eventscheduler.eventsvc.api.dto.request.EmailRequest;
import com.eventscheduler.eventsvc.api.dto.request.PasswordResetConfirmRequest;
import com.eventscheduler.eventsvc.domain.password.PasswordResetService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/users/password-reset")
@RequiredArgsConstructor
@Tag(name = "Password Reset", description = "Forgotten password flow")
public class PasswordResetController {

    private final PasswordResetService passwordResetService;

    @PostMapping
    @Operation(summary = "Request a password reset link")
    @ApiResponse(responseCode = "202", description = "Request accepted")
    @ApiResponse(responseCode = "429", description = "Rate limit exceeded")
    public ResponseEntity<Void> request(@Valid @RequestBody EmailRequest request) {
        passwordResetService.requestReset(request.email());
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/confirm")
    @Operation(summary = "Set a new password using a reset token")
    @ApiResponse(responseCode = "204", description = "Password changed")
    @ApiResponse(responseCode = "400", description = "Invalid password, or token invalid, used or expired")
    public ResponseEntity<Void> confirm(@Valid @RequestBody PasswordResetConfirmRequest request) {
        passwordResetService.confirmReset(request.token(), request.password(), request.confirmPassword());
        return ResponseEntity.noContent().build();
    }
}
