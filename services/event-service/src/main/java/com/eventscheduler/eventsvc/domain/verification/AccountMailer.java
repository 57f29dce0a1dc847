package com.eventscheduler.eventsvc.domain.verification;

import com.eventscheduler.eventsvc.domain.model.TaskKind;
import com.eventscheduler.eventsvc.domain.model.TokenPurpose;
import com.eventscheduler.eventsvc.domain.model.User;
import com.eventscheduler.eventsvc.domain.task.TaskDispatcher;
import com.eventscheduler.eventsvc.domain.task.TaskHandle;
import com.eventscheduler.eventsvc.domain.token.IssuedToken;
import com.eventscheduler.eventsvc.domain.token.VerificationTokenService;
import com.eventscheduler.eventsvc.infra.persistence.UserRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Account emails in two steps. The request side enqueues a task naming only the user, in the
 * caller's transaction. The task handler then issues the token and builds the link, so a raw
 * token is never written to the outbox or the broker.
 */
@Component
public class AccountMailer {

    private final VerificationTokenService tokenService;
    private final TaskDispatcher taskDispatcher;
    private final UserRepository userRepository;
    private final String verificationLinkBase;
    private final String passwordResetLinkBase;

    public AccountMailer(VerificationTokenService tokenService,
                         TaskDispatcher taskDispatcher,
                         UserRepository userRepository,
                         @Value("${app.links.email-verification:http://localhost:8080/verify-email?token=}")
                         String verificationLinkBase,
                         @Value("${app.links.password-reset:http://localhost:8080/reset-password?token=}")
                         String passwordResetLinkBase) {
        this.tokenService = tokenService;
        this.taskDispatcher = taskDispatcher;
        this.userRepository = userRepository;
        this.verificationLinkBase = verificationLinkBase;
        this.passwordResetLinkBase = passwordResetLinkBase;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public TaskHandle sendVerification(User user) {
        return taskDispatcher.enqueue(TaskKind.SEND_VERIFICATION_EMAIL, payloadFor(user));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public TaskHandle sendPasswordReset(User user) {
        return taskDispatcher.enqueue(TaskKind.SEND_PASSWORD_RESET_EMAIL, payloadFor(user));
    }

    /**
     * Issues a fresh verification token, retiring earlier ones.
     *
     * @return empty if the user is gone, disabled or already verified
     */
    @Transactional
    public Optional<AccountLink> verificationLink(UUID userId) {
        return userRepository.findById(userId)
                .filter(User::isActive)
                .filter(user -> !user.isEmailVerified())
                .map(user -> linkFor(user, TokenPurpose.EMAIL_VERIFICATION, verificationLinkBase));
    }

    /**
     * Issues a fresh password reset token, retiring earlier ones.
     *
     * @return empty if the user is gone or disabled
     */
    @Transactional
    public Optional<AccountLink> passwordResetLink(UUID userId) {
        return userRepository.findById(userId)
                .filter(User::isActive)
                .map(user -> linkFor(user, TokenPurpose.PASSWORD_RESET, passwordResetLinkBase));
    }

    private AccountLink linkFor(User user, TokenPurpose purpose, String base) {
        IssuedToken token = tokenService.issue(user, purpose);
        return new AccountLink(user.getEmail(), base + URLEncoder.encode(token.rawValue(), StandardCharsets.UTF_8));
    }

    private static Map<String, String> payloadFor(User user) {
        return Map.of(
                "userId", user.getId().toString(),
                "email", user.getEmail());
    }
}
