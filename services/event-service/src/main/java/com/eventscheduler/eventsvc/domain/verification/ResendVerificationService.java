package com.eventscheduler.eventsvc.domain.verification;

import com.eventscheduler.eventsvc.domain.model.User;
import com.eventscheduler.eventsvc.domain.ratelimit.RateLimitService;
import com.eventscheduler.eventsvc.infra.persistence.UserRepository;
import com.eventscheduler.eventsvc.infrastructure.logging.AuditEvent;
import com.eventscheduler.eventsvc.infrastructure.logging.AuditLogger;
import com.eventscheduler.eventsvc.shared.security.SecurityUtils;
import com.eventscheduler.eventsvc.shared.validation.ValidationService;
import io.micrometer.core.instrument.Counter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.Optional;

/**
 * Resends verification emails. The outcome is the same whether or not the address is registered.
 */
@Service
public class ResendVerificationService {

    private final UserRepository userRepository;
    private final AccountMailer accountMailer;
    private final RateLimitService rateLimitService;
    private final AuditLogger auditLogger;
    private final SecurityUtils securityUtils;
    private final ValidationService validationService;
    private final Counter resendCounter;

    public ResendVerificationService(
            UserRepository userRepository,
            AccountMailer accountMailer,
            RateLimitService rateLimitService,
            AuditLogger auditLogger,
            SecurityUtils securityUtils,
            ValidationService validationService,
            @Qualifier("resendCounter") Counter resendCounter) {
        this.userRepository = userRepository;
        this.accountMailer = accountMailer;
        this.rateLimitService = rateLimitService;
        this.auditLogger = auditLogger;
        this.securityUtils = securityUtils;
        this.validationService = validationService;
        this.resendCounter = resendCounter;
    }

    @Transactional
    public void resend(String email) {
        validationService.validateEmail(email).throwIfInvalid();
        String normalizedEmail = validationService.normalizeEmail(email);

        rateLimitService.checkEmailLimit(normalizedEmail);
        resendCounter.increment();

        String correlationId = securityUtils.getCurrentCorrelationId();
        Optional<User> userOpt = userRepository.findByEmail(normalizedEmail);

        if (userOpt.isPresent()) {
            User user = userOpt.get();
            if (user.isActive() && !user.isEmailVerified()) {
                accountMailer.sendVerification(user);
                auditLogger.logAudit(AuditEvent.of(
                        "VERIFICATION_RESENT", user.getId().toString(), correlationId,
                        "Verification email resent",
                        Map.of("email", securityUtils.maskEmail(normalizedEmail))));
            }
        }

        auditLogger.logAudit(AuditEvent.of(
                "RESEND_REQUESTED", null, correlationId,
                "Resend verification requested",
                Map.of("maskedEmail", securityUtils.maskEmail(normalizedEmail))));
    }
}
