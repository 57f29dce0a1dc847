package com.eventscheduler.eventsvc.shared.validation;

/**
 * Field-level validation error reported back to the caller.
 */
public record FieldError(String field, String code, String message) {

    public static FieldError of(String field, String code, String message) {
        return new FieldError(field, code, message);
    }

    public static FieldError required(String field) {
        return new FieldError(field, "REQUIRED", field + " is required");
    }
}
