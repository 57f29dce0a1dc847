package com.eventscheduler.eventsvc.domain.token;

import com.eventscheduler.eventsvc.domain.model.TokenPurpose;
import com.eventscheduler.eventsvc.domain.model.User;
import com.eventscheduler.eventsvc.domain.model.VerificationToken;
import com.eventscheduler.eventsvc.infra.persistence.VerificationTokenRepository;
import com.eventscheduler.eventsvc.shared.crypto.TokenHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Issues and validates single-use, time-bound tokens.
 *
 * <p>A successful validation consumes the token in the caller's transaction, together with
 * whatever state change the token authorizes. If that change fails, the consumption rolls back
 * with it and the token stays usable.
 */
@Service
public class VerificationTokenService {

    private static final Logger log = LoggerFactory.getLogger(VerificationTokenService.class);

    private final VerificationTokenRepository tokenRepository;
    private final TokenHasher tokenHasher;
    private final Clock clock;
    private final Duration emailVerificationTtl;
    private final Duration passwordResetTtl;

    public VerificationTokenService(
            VerificationTokenRepository tokenRepository,
            TokenHasher tokenHasher,
            Clock clock,
            @Value("${app.tokens.email-verification-ttl:PT1H}") Duration emailVerificationTtl,
            @Value("${app.tokens.password-reset-ttl:PT1H}") Duration passwordResetTtl) {
        this.tokenRepository = tokenRepository;
        this.tokenHasher = tokenHasher;
        this.clock = clock;
        this.emailVerificationTtl = emailVerificationTtl;
        this.passwordResetTtl = passwordResetTtl;
    }

    @Transactional
    public IssuedToken issue(User user, TokenPurpose purpose) {
        return issue(user, purpose, ttlFor(purpose));
    }

    /**
     * Issues a new token and retires any earlier unconsumed token of the same user and purpose.
     */
    @Transactional
    public IssuedToken issue(User user, TokenPurpose purpose, Duration ttl) {
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("Token ttl must not be negative");
        }
        Instant now = clock.instant();
        int retired = tokenRepository.consumeOutstanding(user.getId(), purpose, now);
        if (retired > 0) {
            log.debug("Retired {} outstanding {} tokens for userId={}", retired, purpose, user.getId());
        }

        String rawValue = tokenHasher.generateToken();
        VerificationToken token = VerificationToken.builder()
                .user(user)
                .purpose(purpose)
                .tokenHash(tokenHasher.hash(rawValue))
                .createdAt(now)
                .expiresAt(now.plus(ttl))
                .build();
        tokenRepository.save(token);

        return new IssuedToken(rawValue, purpose, token.getExpiresAt());
    }

    /**
     * Validates and, when valid, consumes the token.
     */
    @Transactional
    public TokenValidation validate(String rawValue, TokenPurpose purpose) {
        return validate(rawValue, purpose, owner -> { });
    }

    /**
     * Validates the token and, when valid, consumes it and applies {@code sideEffect} to its owner.
     * The token row is locked for the rest of the transaction, so concurrent attempts with the same
     * value see it consumed.
     */
    @Transactional
    public TokenValidation validate(String rawValue, TokenPurpose purpose, Consumer<User> sideEffect) {
        if (rawValue == null || rawValue.isBlank()) {
            return TokenValidation.notFound();
        }
        Optional<VerificationToken> found =
                tokenRepository.findByHashAndPurposeForUpdate(tokenHasher.hash(rawValue), purpose);
        if (found.isEmpty()) {
            return TokenValidation.notFound();
        }

        VerificationToken token = found.get();
        Instant now = clock.instant();
        if (token.isExpired(now)) {
            return TokenValidation.expired(token.getUser());
        }
        if (token.isConsumed()) {
            return TokenValidation.consumed();
        }

        token.consume(now);
        User owner = token.getUser();
        sideEffect.accept(owner);
        return TokenValidation.valid(owner);
    }

    /**
     * Deletes tokens that expired or were consumed before {@code cutoff}.
     */
    @Transactional
    public int purgeSettledBefore(Instant cutoff) {
        return tokenRepository.deleteSettledBefore(cutoff);
    }

    Duration ttlFor(TokenPurpose purpose) {
        return switch (purpose) {
            case EMAIL_VERIFICATION -> emailVerificationTtl;
            case PASSWORD_RESET -> passwordResetTtl;
        };
    }
}
