package com.eventscheduler.eventsvc.domain.auth;

import com.eventscheduler.eventsvc.domain.model.User;
import com.eventscheduler.eventsvc.infra.persistence.UserRepository;
import com.eventscheduler.eventsvc.infrastructure.logging.AuditLogger;
import com.eventscheduler.eventsvc.infrastructure.logging.SecurityEvent;
import com.eventscheduler.eventsvc.shared.crypto.PasswordService;
import com.eventscheduler.eventsvc.shared.exception.InvalidCredentialsException;
import com.eventscheduler.eventsvc.shared.security.JwtTokenService;
import com.eventscheduler.eventsvc.shared.security.SecurityUtils;
import com.eventscheduler.eventsvc.shared.validation.ValidationService;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Email and password login. Every failure looks the same to the caller.
 */
@Service
public class AuthenticationService {

    private final UserRepository userRepository;
    private final PasswordService passwordService;
    private final JwtTokenService jwtTokenService;
    private final ValidationService validationService;
    private final AuditLogger auditLogger;
    private final SecurityUtils securityUtils;

    public AuthenticationService(UserRepository userRepository,
                                 PasswordService passwordService,
                                 JwtTokenService jwtTokenService,
                                 ValidationService validationService,
                                 AuditLogger auditLogger,
                                 SecurityUtils securityUtils) {
        this.userRepository = userRepository;
        this.passwordService = passwordService;
        this.jwtTokenService = jwtTokenService;
        this.validationService = validationService;
        this.auditLogger = auditLogger;
        this.securityUtils = securityUtils;
    }

    @Transactional(readOnly = true)
    public LoginResult login(String email, String password, String ipAddress) {
        String normalizedEmail = validationService.normalizeEmail(email);
        Optional<User> userOpt = normalizedEmail == null || normalizedEmail.isEmpty()
                ? Optional.empty()
                : userRepository.findByEmail(normalizedEmail);

        if (userOpt.isEmpty()) {
            passwordService.verifyAgainstUnknownUser(password);
            throw rejected(normalizedEmail, ipAddress, "unknown email");
        }

        User user = userOpt.get();
        if (!passwordService.verify(password, user.getPasswordHash())) {
            throw rejected(normalizedEmail, ipAddress, "wrong password");
        }
        if (!user.isActive()) {
            throw rejected(normalizedEmail, ipAddress, "account disabled");
        }

        JwtTokenService.AccessToken token = jwtTokenService.issue(user.getId());
        return new LoginResult(user.getId(), token.value(), token.expiresAt(), user.isEmailVerified());
    }

    private InvalidCredentialsException rejected(String email, String ipAddress, String reason) {
        auditLogger.logSecurity(SecurityEvent.of("LOGIN_FAILED", ipAddress, email,
                securityUtils.getCurrentCorrelationId(), "Login rejected: " + reason));
        return new InvalidCredentialsException();
    }
}
