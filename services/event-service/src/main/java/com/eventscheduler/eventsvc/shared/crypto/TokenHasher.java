package com.eventscheduler.eventsvc.shared.crypto;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Generates opaque single-use token values and derives the SHA-256 digest that is persisted.
 * Raw values only ever travel to the user; lookups always go through {@link #hash(String)}.
 */
@Component
public class TokenHasher {

    static final int TOKEN_BYTES = 32;
    private static final String DIGEST_ALGORITHM = "SHA-256";

    private final SecureRandom secureRandom = new SecureRandom();
    private final HexFormat hex = HexFormat.of();

    /**
     * Returns 32 random bytes as a 64-char lower-case hex string.
     */
    public String generateToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        return hex.formatHex(bytes);
    }

    /**
     * SHA-256 of the raw value, hex encoded.
     */
    public String hash(String rawToken) {
        if (rawToken == null || rawToken.isBlank()) {
            throw new IllegalArgumentException("Token cannot be null or blank");
        }
        return hex.formatHex(digest().digest(rawToken.trim().getBytes(StandardCharsets.UTF_8)));
    }

    private static MessageDigest digest() {
        try {
            return MessageDigest.getInstance(DIGEST_ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(DIGEST_ALGORITHM + " not available", e);
        }
    }
}
