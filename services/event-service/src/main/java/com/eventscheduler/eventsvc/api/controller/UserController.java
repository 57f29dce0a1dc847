package com.eventscheduler.eventsvc.api.controller;

import com.eventscheduler.eventsvc.api.dto.request.UserRegistrationRequest;
import com.eventscheduler.eventsvc.api.dto.response.UserRegistrationResponse;
import com.eventscheduler.eventsvc.domain.registration.RegistrationResult;
import com.eventscheduler.eventsvc.domain.registration.RegistrationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/users")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Users", description = "Account registration")
public class UserController {

    private final RegistrationService registrationService;

    @PostMapping
    @Operation(summary = "Register a new account", description = "Creates an unverified account and mails a verification link")
    @ApiResponse(responseCode = "201", description = "Account created")
    @ApiResponse(responseCode = "400", description = "Validation error")
    @ApiResponse(responseCode = "409", description = "Email already registered")
    @ApiResponse(responseCode = "429", description = "Rate limit exceeded")
    public ResponseEntity<UserRegistrationResponse> register(@Valid @RequestBody UserRegistrationRequest request) {
        RegistrationResult result = registrationService.register(
                request.email(), request.password(), request.confirmPassword());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new UserRegistrationResponse(result.userId(), result.slug(), result.verified()));
    }
}
