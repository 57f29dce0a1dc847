package com.eventscheduler.eventsvc.api.controller;

import com.eventscheduler.eventsvc.api.dto.request.ProfileUpdateRequest;
import com.eventscheduler.eventsvc.api.dto.response.ProfileResponse;
import com.eventscheduler.eventsvc.domain.profile.ProfileService;
import com.eventscheduler.eventsvc.shared.security.SecurityUtils;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/me")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Profile", description = "User profile management")
@SecurityRequirement(name = "bearer-jwt")
public class MeController {

    private final ProfileService profileService;
    private final SecurityUtils securityUtils;

    @GetMapping
    @Operation(summary = "Get current user profile")
    @ApiResponse(responseCode = "200", description = "Profile retrieved")
    @ApiResponse(responseCode = "401", description = "Not authenticated")
    public ResponseEntity<ProfileResponse> getProfile() {
        UUID userId = securityUtils.requireCurrentUserId();
        return ResponseEntity.ok(ProfileResponse.from(profileService.getProfile(userId)));
    }

    @PatchMapping
    @Operation(summary = "Change email address", description = "The new address must be verified again")
    @ApiResponse(responseCode = "200", description = "Profile updated")
    @ApiResponse(responseCode = "400", description = "Validation error")
    @ApiResponse(responseCode = "409", description = "Email already registered")
    public ResponseEntity<ProfileResponse> updateProfile(@Valid @RequestBody ProfileUpdateRequest request) {
        UUID userId = securityUtils.requireCurrentUserId();
        return ResponseEntity.ok(ProfileResponse.from(profileService.updateEmail(userId, request.email())));
    }

    @DeleteMapping
    @Operation(summary = "Disable the current account")
    @ApiResponse(responseCode = "204", description = "Account disabled")
    public ResponseEntity<Void> disable() {
        UUID userId = securityUtils.requireCurrentUserId();
        profileService.disable(userId);
        log.info("Account disabled at owner request");
        return ResponseEntity.noContent().build();
    }
}
