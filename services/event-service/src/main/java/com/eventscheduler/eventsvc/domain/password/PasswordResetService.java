package com.eventscheduler.eventsvc.domain.password;

import com.eventscheduler.eventsvc.domain.model.TokenPurpose;
import com.eventscheduler.eventsvc.domain.model.User;
import com.eventscheduler.eventsvc.domain.ratelimit.RateLimitService;
import com.eventscheduler.eventsvc.domain.token.TokenValidation;
import com.eventscheduler.eventsvc.domain.token.VerificationTokenService;
import com.eventscheduler.eventsvc.domain.verification.AccountMailer;
import com.eventscheduler.eventsvc.infra.persistence.UserRepository;
import com.eventscheduler.eventsvc.infrastructure.logging.AuditEvent;
import com.eventscheduler.eventsvc.infrastructure.logging.AuditLogger;
import com.eventscheduler.eventsvc.shared.crypto.PasswordService;
import com.eventscheduler.eventsvc.shared.exception.AlreadyUsedException;
import com.eventscheduler.eventsvc.shared.exception.ExpiredTokenException;
import com.eventscheduler.eventsvc.shared.exception.InvalidTokenException;
import com.eventscheduler.eventsvc.shared.security.SecurityUtils;
import com.eventscheduler.eventsvc.shared.validation.ValidationResult;
import com.eventscheduler.eventsvc.shared.validation.ValidationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * Two-step password reset: request a link by email, then confirm with the token and a new password.
 */
@Service
@Slf4j
public class PasswordResetService {

    private final UserRepository userRepository;
    private final VerificationTokenService tokenService;
    private final AccountMailer accountMailer;
    private final PasswordService passwordService;
    private final ValidationService validationService;
    private final RateLimitService rateLimitService;
    private final AuditLogger auditLogger;
    private final SecurityUtils securityUtils;

    public PasswordResetService(
            UserRepository userRepository,
            VerificationTokenService tokenService,
            AccountMailer accountMailer,
            PasswordService passwordService,
            ValidationService validationService,
            RateLimitService rateLimitService,
            AuditLogger auditLogger,
            SecurityUtils securityUtils) {
        this.userRepository = userRepository;
        this.tokenService = tokenService;
        this.accountMailer = accountMailer;
        this.passwordService = passwordService;
        this.validationService = validationService;
        this.rateLimitService = rateLimitService;
        this.auditLogger = auditLogger;
        this.securityUtils = securityUtils;
    }

    /**
     * Sends a reset link to active accounts. Unknown addresses are accepted silently.
     */
    @Transactional
    public void requestReset(String email) {
        validationService.validateEmail(email).throwIfInvalid();
        String normalizedEmail = validationService.normalizeEmail(email);
        rateLimitService.checkEmailLimit(normalizedEmail);

        userRepository.findByEmail(normalizedEmail)
                .filter(User::isActive)
                .ifPresent(user -> {
                    accountMailer.sendPasswordReset(user);
                    auditLogger.logAudit(AuditEvent.of(
                            "PASSWORD_RESET_REQUESTED", user.getId().toString(),
                            securityUtils.getCurrentCorrelationId(), "Password reset requested"));
                });
    }

    /**
     * Consumes the reset token and stores the new password hash in one transaction.
     */
    @Transactional
    public void confirmReset(String token, String password, String confirmPassword) {
        ValidationResult.merge(
                validationService.validatePassword(password),
                validationService.validatePasswordConfirmation(password, confirmPassword)
        ).throwIfInvalid();

        String newHash = passwordService.hash(password);
        TokenValidation validation = tokenService.validate(token, TokenPurpose.PASSWORD_RESET,
                user -> user.setPasswordHash(newHash));

        switch (validation.status()) {
            case VALID -> {
                User user = validation.owner();
                log.debug("Password reset completed: userId={}", user.getId());
                auditLogger.logAudit(AuditEvent.of(
                        "PASSWORD_RESET", user.getId().toString(), securityUtils.getCurrentCorrelationId(),
                        "Password changed through reset link"));
            }
            case EXPIRED -> throw new ExpiredTokenException();
            case CONSUMED -> throw new AlreadyUsedException();
            default -> throw new InvalidTokenException();
        }
    }
}
