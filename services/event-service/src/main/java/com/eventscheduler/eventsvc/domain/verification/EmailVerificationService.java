package com.eventscheduler.eventsvc.domain.verification;

import com.eventscheduler.eventsvc.domain.model.TokenPurpose;
import com.eventscheduler.eventsvc.domain.model.User;
import com.eventscheduler.eventsvc.domain.token.TokenValidation;
import com.eventscheduler.eventsvc.domain.token.VerificationTokenService;
import com.eventscheduler.eventsvc.infrastructure.logging.AuditEvent;
import com.eventscheduler.eventsvc.infrastructure.logging.AuditLogger;
import com.eventscheduler.eventsvc.shared.exception.AlreadyUsedException;
import com.eventscheduler.eventsvc.shared.exception.ExpiredTokenException;
import com.eventscheduler.eventsvc.shared.exception.InvalidTokenException;
import com.eventscheduler.eventsvc.shared.security.SecurityUtils;
import io.micrometer.core.instrument.Counter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * Confirms ownership of an email address.
 */
@Service
public class EmailVerificationService {

    private final VerificationTokenService tokenService;
    private final AccountMailer accountMailer;
    private final AuditLogger auditLogger;
    private final SecurityUtils securityUtils;
    private final Counter verificationCounter;

    public EmailVerificationService(
            VerificationTokenService tokenService,
            AccountMailer accountMailer,
            AuditLogger auditLogger,
            SecurityUtils securityUtils,
            @Qualifier("verificationCounter") Counter verificationCounter) {
        this.tokenService = tokenService;
        this.accountMailer = accountMailer;
        this.auditLogger = auditLogger;
        this.securityUtils = securityUtils;
        this.verificationCounter = verificationCounter;
    }

    /**
     * Consumes the token and marks its owner verified in one transaction.
     * An expired token still commits a fresh verification email before the error is reported.
     */
    @Transactional(noRollbackFor = ExpiredTokenException.class)
    public User verify(String token) {
        TokenValidation validation = tokenService.validate(token, TokenPurpose.EMAIL_VERIFICATION,
                User::markEmailVerified);

        switch (validation.status()) {
            case VALID -> {
                User user = validation.owner();
                verificationCounter.increment();
                auditLogger.logAudit(AuditEvent.of(
                        "EMAIL_VERIFIED", user.getId().toString(), securityUtils.getCurrentCorrelationId(),
                        "Email verified successfully",
                        Map.of("email", securityUtils.maskEmail(user.getEmail()))));
                return user;
            }
            case EXPIRED -> {
                User user = validation.owner();
                if (user.isActive() && !user.isEmailVerified()) {
                    accountMailer.sendVerification(user);
                }
                throw new ExpiredTokenException();
            }
            case CONSUMED -> throw new AlreadyUsedException();
            default -> throw new InvalidTokenException();
        }
    }
}
