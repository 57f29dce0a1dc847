package com.eventscheduler.eventsvc.api.controller;

import com.eventscheduler.eventsvc.api.dto.request.EmailRequest;
import com.eventscheduler.eventsvc.api.dto.request.EmailVerificationRequest;
import com.eventscheduler.eventsvc.api.dto.response.ProfileResponse;
import com.eventscheduler.eventsvc.domain.model.User;
import com.eventscheduler.eventsvc.domain.verification.EmailVerificationService;
import com.eventscheduler.eventsvc.domain.verification.ResendVerificationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/users")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Email Verification", description = "Email verification endpoints")
public class EmailVerificationController {

    private final EmailVerificationService verificationService;
    private final ResendVerificationService resendService;

    @PostMapping("/verify")
    @Operation(summary = "Verify email address", description = "Consumes a verification token and marks the email as verified")
    @ApiResponse(responseCode = "200", description = "Email verified")
    @ApiResponse(responseCode = "400", description = "Token invalid, already used, or expired (a new one is then sent)")
    public ResponseEntity<ProfileResponse> verify(@Valid @RequestBody EmailVerificationRequest request) {
        User user = verificationService.verify(request.token());
        return ResponseEntity.ok(ProfileResponse.from(user));
    }

    @PostMapping("/resend-verification")
    @Operation(summary = "Resend verification email",
            description = "Always accepted so callers cannot tell whether the address is registered")
    @ApiResponse(responseCode = "202", description = "Request accepted")
    @ApiResponse(responseCode = "429", description = "Rate limit exceeded")
    public ResponseEntity<Void> resend(@Valid @RequestBody EmailRequest request) {
        resendService.resend(request.email());
        return ResponseEntity.accepted().build();
    }
}
