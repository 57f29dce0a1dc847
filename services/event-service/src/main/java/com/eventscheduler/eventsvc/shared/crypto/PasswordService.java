package com.eventscheduler.eventsvc.shared.crypto;

import de.mkammerer.argon2.Argon2;
import de.mkammerer.argon2.Argon2Factory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Argon2id password hashing. Parameters come from {@code app.argon2.*}.
 */
@Service
public class PasswordService {

    private final Argon2 argon2;
    private final int memoryKb;
    private final int iterations;
    private final int parallelism;
    private final String unknownUserHash;

    public PasswordService(
            @Value("${app.argon2.memory-kb:19456}") int memoryKb,
            @Value("${app.argon2.iterations:2}") int iterations,
            @Value("${app.argon2.parallelism:1}") int parallelism) {
        this.argon2 = Argon2Factory.create(Argon2Factory.Argon2Types.ARGON2id);
        this.memoryKb = memoryKb;
        this.iterations = iterations;
        this.parallelism = parallelism;
        this.unknownUserHash = hash("unknown-user-placeholder");
    }

    /**
     * Hashes a password; the result starts with {@code $argon2id$} and embeds its parameters.
     */
    public String hash(String password) {
        if (password == null || password.isEmpty()) {
            throw new IllegalArgumentException("Password cannot be null or empty");
        }
        char[] chars = password.toCharArray();
        try {
            return argon2.hash(iterations, memoryKb, parallelism, chars);
        } finally {
            argon2.wipeArray(chars);
        }
    }

    public boolean verify(String password, String hash) {
        if (password == null || hash == null) {
            return false;
        }
        return argon2.verify(hash, password.toCharArray());
    }

    /**
     * Burns the same amount of work as a real verification so that login timing
     * does not reveal whether an email is registered.
     */
    public void verifyAgainstUnknownUser(String password) {
        verify(password == null ? "" : password, unknownUserHash);
    }
}
