package com.eventscheduler.eventsvc.api.error;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * RFC 7807 Problem Detail response format. The type URI and title are derived from the error code,
 * e.g. {@code CAPACITY_EXCEEDED} becomes {@code .../problems/capacity-exceeded}, "Capacity exceeded".
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ProblemDetail(
        String type,
        String title,
        int status,
        String detail,
        String instance,
        Instant timestamp,
        String correlationId,
        String errorCode,
        Map<String, Object> extensions
) {
    static final String TYPE_BASE = "https://api.event-scheduler.dev/problems/";

    public static ProblemDetail forCode(String errorCode, int status, String detail,
                                        String instance, String correlationId) {
        return new ProblemDetail(TYPE_BASE + errorCode.toLowerCase().replace('_', '-'), titleOf(errorCode),
                status, detail, instance, Instant.now(), correlationId, errorCode, Map.of());
    }

    /**
     * Copy with one more extension member.
     */
    public ProblemDetail with(String key, Object value) {
        Map<String, Object> merged = new HashMap<>(extensions);
        merged.put(key, value);
        return new ProblemDetail(type, title, status, detail, instance, timestamp, correlationId, errorCode, merged);
    }

    private static String titleOf(String errorCode) {
        String words = errorCode.replace('_', ' ').toLowerCase();
        return Character.toUpperCase(words.charAt(0)) + words.substring(1);
    }
}
