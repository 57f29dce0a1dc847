package com.eventscheduler.eventsvc.api.controller;

import com.eventscheduler.eventsvc.api.dto.request.LoginRequest;
import com.eventscheduler.eventsvc.api.dto.response.LoginResponse;
import com.eventscheduler.eventsvc.domain.auth.AuthenticationService;
import com.eventscheduler.eventsvc.domain.auth.LoginResult;
import com.eventscheduler.eventsvc.shared.security.ClientIpResolver;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
@Tag(name = "Authentication", description = "Credential exchange for access tokens")
public class AuthController {

    private final AuthenticationService authenticationService;
    private final ClientIpResolver clientIpResolver;

    @PostMapping("/login")
    @Operation(summary = "Log in", description = "Exchanges email and password for a bearer token")
    @ApiResponse(responseCode = "200", description = "Authenticated")
    @ApiResponse(responseCode = "401", description = "Invalid credentials")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request,
                                               HttpServletRequest httpRequest) {
        LoginResult result = authenticationService.login(
                request.email(), request.password(), clientIpResolver.resolve(httpRequest));
        return ResponseEntity.ok(new LoginResponse(
                result.accessToken(), "Bearer", result.expiresAt(), result.userId(), result.verified()));
    }
}
