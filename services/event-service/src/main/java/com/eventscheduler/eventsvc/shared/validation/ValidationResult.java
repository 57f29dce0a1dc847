package com.eventscheduler.eventsvc.shared.validation;

import com.eventscheduler.eventsvc.shared.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;

public record ValidationResult(boolean valid, List<FieldError> errors) {

    public static ValidationResult success() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult failure(List<FieldError> errors) {
        return new ValidationResult(false, List.copyOf(errors));
    }

    public static ValidationResult failure(FieldError error) {
        return new ValidationResult(false, List.of(error));
    }

    /**
     * Combines several results, keeping every error in order.
     */
    public static ValidationResult merge(ValidationResult... results) {
        List<FieldError> all = new ArrayList<>();
        for (ValidationResult result : results) {
            all.addAll(result.errors());
        }
        return all.isEmpty() ? success() : failure(all);
    }

    public void throwIfInvalid() {
        if (!valid) {
            throw new ValidationException(errors);
        }
    }
}
