package com.eventscheduler.eventsvc.domain.registration;

import com.eventscheduler.eventsvc.domain.model.User;
import com.eventscheduler.eventsvc.domain.model.UserStatus;
import com.eventscheduler.eventsvc.domain.verification.AccountMailer;
import com.eventscheduler.eventsvc.infra.persistence.UserRepository;
import com.eventscheduler.eventsvc.infrastructure.logging.AuditEvent;
import com.eventscheduler.eventsvc.infrastructure.logging.AuditLogger;
import com.eventscheduler.eventsvc.shared.crypto.PasswordService;
import com.eventscheduler.eventsvc.shared.exception.EmailExistsException;
import com.eventscheduler.eventsvc.shared.security.SecurityUtils;
import com.eventscheduler.eventsvc.shared.text.SlugGenerator;
import com.eventscheduler.eventsvc.shared.validation.ValidationService;
import io.micrometer.core.instrument.Counter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * Service for user registration with email verification.
 */
@Service
public class RegistrationService {

    private final UserRepository userRepository;
    private final ValidationService validationService;
    private final PasswordService passwordService;
    private final SlugGenerator slugGenerator;
    private final AccountMailer accountMailer;
    private final AuditLogger auditLogger;
    private final SecurityUtils securityUtils;
    private final Counter registrationCounter;

    public RegistrationService(
            UserRepository userRepository,
            ValidationService validationService,
            PasswordService passwordService,
            SlugGenerator slugGenerator,
            AccountMailer accountMailer,
            AuditLogger auditLogger,
            SecurityUtils securityUtils,
            @Qualifier("registrationCounter") Counter registrationCounter) {
        this.userRepository = userRepository;
        this.validationService = validationService;
        this.passwordService = passwordService;
        this.slugGenerator = slugGenerator;
        this.accountMailer = accountMailer;
        this.auditLogger = auditLogger;
        this.securityUtils = securityUtils;
        this.registrationCounter = registrationCounter;
    }

    @Transactional
    public RegistrationResult register(String email, String password, String confirmPassword) {
        validationService.validateRegistration(email, password, confirmPassword).throwIfInvalid();

        String normalizedEmail = validationService.normalizeEmail(email);
        if (userRepository.existsByEmail(normalizedEmail)) {
            throw new EmailExistsException();
        }

        String localPart = normalizedEmail.substring(0, normalizedEmail.indexOf('@'));
        User user = User.builder()
                .email(normalizedEmail)
                .slug(slugGenerator.generateUnique(localPart, userRepository::existsBySlug))
                .passwordHash(passwordService.hash(password))
                .emailVerified(false)
                .status(UserStatus.ACTIVE)
                .build();

        try {
            user = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            // concurrent registration with the same email
            throw new EmailExistsException();
        }

        accountMailer.sendVerification(user);
        registrationCounter.increment();

        auditLogger.logAudit(AuditEvent.of(
                "USER_REGISTERED", user.getId().toString(), securityUtils.getCurrentCorrelationId(),
                "User registered",
                Map.of("email", securityUtils.maskEmail(normalizedEmail))));

        return new RegistrationResult(user.getId(), user.getSlug(), user.isEmailVerified());
    }
}
