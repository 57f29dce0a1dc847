package com.eventscheduler.eventsvc.domain.profile;

import com.eventscheduler.eventsvc.domain.model.User;
import com.eventscheduler.eventsvc.domain.verification.AccountMailer;
import com.eventscheduler.eventsvc.infra.persistence.UserRepository;
import com.eventscheduler.eventsvc.infrastructure.logging.AuditEvent;
import com.eventscheduler.eventsvc.infrastructure.logging.AuditLogger;
import com.eventscheduler.eventsvc.shared.exception.EmailExistsException;
import com.eventscheduler.eventsvc.shared.exception.ValidationException;
import com.eventscheduler.eventsvc.shared.security.SecurityUtils;
import com.eventscheduler.eventsvc.shared.validation.FieldError;
import com.eventscheduler.eventsvc.shared.validation.ValidationService;
import io.micrometer.core.instrument.Counter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.UUID;

/**
 * The caller's own account: read it, change its email, disable it.
 */
@Service
public class ProfileService {

    private final UserRepository userRepository;
    private final ValidationService validationService;
    private final AccountMailer accountMailer;
    private final AuditLogger auditLogger;
    private final SecurityUtils securityUtils;
    private final Counter profileUpdateCounter;

    public ProfileService(
            UserRepository userRepository,
            ValidationService validationService,
            AccountMailer accountMailer,
            AuditLogger auditLogger,
            SecurityUtils securityUtils,
            @Qualifier("profileUpdateCounter") Counter profileUpdateCounter) {
        this.userRepository = userRepository;
        this.validationService = validationService;
        this.accountMailer = accountMailer;
        this.auditLogger = auditLogger;
        this.securityUtils = securityUtils;
        this.profileUpdateCounter = profileUpdateCounter;
    }

    @Transactional(readOnly = true)
    public User getProfile(UUID userId) {
        return userRepository.getActiveUser(userId);
    }

    /**
     * Changes the email, marks the account unverified and sends a verification email to the new address.
     */
    @Transactional
    public User updateEmail(UUID userId, String email) {
        User user = userRepository.getActiveUser(userId);

        validationService.validateEmail(email).throwIfInvalid();
        String normalizedEmail = validationService.normalizeEmail(email);

        if (normalizedEmail.equals(user.getEmail())) {
            throw new ValidationException(FieldError.of("email", "UNCHANGED",
                    "The new email must be different from the current one"));
        }
        if (userRepository.existsByEmail(normalizedEmail)) {
            throw new EmailExistsException();
        }

        String previousEmail = user.getEmail();
        user.changeEmail(normalizedEmail);
        userRepository.saveAndFlush(user);
        accountMailer.sendVerification(user);
        profileUpdateCounter.increment();

        auditLogger.logAudit(AuditEvent.of(
                "EMAIL_CHANGED", user.getId().toString(), securityUtils.getCurrentCorrelationId(),
                "Email changed, verification required",
                Map.of("previousEmail", securityUtils.maskEmail(previousEmail),
                        "email", securityUtils.maskEmail(normalizedEmail))));
        return user;
    }

    /**
     * Soft-deletes the account. Events it created stay in place.
     */
    @Transactional
    public void disable(UUID userId) {
        User user = userRepository.getActiveUser(userId);
        user.disable();
        auditLogger.logAudit(AuditEvent.of(
                "ACCOUNT_DISABLED", user.getId().toString(), securityUtils.getCurrentCorrelationId(),
                "Account disabled by its owner"));
    }
}
