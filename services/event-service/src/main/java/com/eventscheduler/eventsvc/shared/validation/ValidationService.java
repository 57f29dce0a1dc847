package com.eventscheduler.eventsvc.shared.validation;

import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Explicit validation of user and event input before anything is persisted.
 */
@Service
public class ValidationService {

    private static final Pattern EMAIL_PATTERN = Pattern.compile(
            "^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$"
    );

    static final int EMAIL_MAX_LENGTH = 254;
    static final int PASSWORD_MIN_LENGTH = 8;
    static final int PASSWORD_MAX_LENGTH = 128;
    static final int TITLE_MAX_LENGTH = 256;
    static final int DESCRIPTION_MAX_LENGTH = 8192;

    /**
     * Validates email format: exactly one '@', a dotted domain, bounded length.
     */
    public ValidationResult validateEmail(String email) {
        if (email == null || email.isBlank()) {
            return ValidationResult.failure(FieldError.required("email"));
        }

        String normalized = normalizeEmail(email);

        if (normalized.chars().filter(c -> c == '@').count() != 1) {
            return ValidationResult.failure(FieldError.of("email", "INVALID_FORMAT",
                    "Enter a valid email address. It has multiple @ or none."));
        }

        if (normalized.length() > EMAIL_MAX_LENGTH || !EMAIL_PATTERN.matcher(normalized).matches()) {
            return ValidationResult.failure(FieldError.of("email", "INVALID_FORMAT", "Enter a valid email address."));
        }

        return ValidationResult.success();
    }

    /**
     * Password policy: 8-128 characters with at least one upper-case letter, one lower-case letter and one digit.
     */
    public ValidationResult validatePassword(String password) {
        if (password == null || password.isEmpty()) {
            return ValidationResult.failure(FieldError.required("password"));
        }

        List<FieldError> errors = new ArrayList<>();

        if (password.length() < PASSWORD_MIN_LENGTH) {
            errors.add(FieldError.of("password", "TOO_SHORT",
                    "Password must be at least " + PASSWORD_MIN_LENGTH + " characters"));
        }

        if (password.length() > PASSWORD_MAX_LENGTH) {
            errors.add(FieldError.of("password", "TOO_LONG",
                    "Password must not exceed " + PASSWORD_MAX_LENGTH + " characters"));
        }

        if (!password.matches("(?s).*[A-Z].*")) {
            errors.add(FieldError.of("password", "MISSING_UPPERCASE",
                    "The password must contain at least 1 uppercase letter."));
        }

        if (!password.matches("(?s).*[a-z].*")) {
            errors.add(FieldError.of("password", "MISSING_LOWERCASE",
                    "The password must contain at least 1 lowercase letter."));
        }

        if (!password.matches("(?s).*\\d.*")) {
            errors.add(FieldError.of("password", "MISSING_DIGIT",
                    "The password must contain at least 1 digit."));
        }

        return errors.isEmpty() ? ValidationResult.success() : ValidationResult.failure(errors);
    }

    public ValidationResult validatePasswordConfirmation(String password, String confirmPassword) {
        if (password != null && !password.equals(confirmPassword)) {
            return ValidationResult.failure(FieldError.of("confirmPassword", "MISMATCH", "Passwords don't match!"));
        }
        return ValidationResult.success();
    }

    public ValidationResult validateRegistration(String email, String password, String confirmPassword) {
        return ValidationResult.merge(
                validateEmail(email),
                validatePassword(password),
                validatePasswordConfirmation(password, confirmPassword));
    }

    /**
     * Validates the event fields shared by creation and update.
     * Null arguments are skipped when {@code partial} is set (PATCH semantics).
     */
    public ValidationResult validateEvent(String title, String description, Instant startsAt, Instant endsAt,
                                          Integer capacity, Instant now, boolean partial) {
        List<FieldError> errors = new ArrayList<>();

        if (title != null || !partial) {
            if (title == null || title.isBlank()) {
                errors.add(FieldError.required("title"));
            } else if (title.trim().length() > TITLE_MAX_LENGTH) {
                errors.add(FieldError.of("title", "TOO_LONG",
                        "Title must not exceed " + TITLE_MAX_LENGTH + " characters"));
            }
        }

        if (description != null || !partial) {
            if (description == null || description.isBlank()) {
                errors.add(FieldError.required("description"));
            } else if (description.length() > DESCRIPTION_MAX_LENGTH) {
                errors.add(FieldError.of("description", "TOO_LONG",
                        "The description cannot be longer than " + DESCRIPTION_MAX_LENGTH + " characters"));
            }
        }

        if (startsAt != null || !partial) {
            if (startsAt == null) {
                errors.add(FieldError.required("startsAt"));
            } else if (startsAt.isBefore(now)) {
                errors.add(FieldError.of("startsAt", "IN_PAST", "Cannot schedule events in a past time"));
            }
        }

        if (endsAt != null && startsAt != null && !endsAt.isAfter(startsAt)) {
            errors.add(FieldError.of("endsAt", "BEFORE_START", "Event must end after it starts"));
        }

        if (capacity != null && capacity < 1) {
            errors.add(FieldError.of("capacity", "TOO_SMALL", "Capacity must be at least 1"));
        }

        return errors.isEmpty() ? ValidationResult.success() : ValidationResult.failure(errors);
    }

    public String normalizeEmail(String email) {
        if (email == null) return null;
        return email.trim().toLowerCase();
    }
}
