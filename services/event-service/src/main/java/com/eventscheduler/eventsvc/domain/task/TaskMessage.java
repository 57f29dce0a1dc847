package com.eventscheduler.eventsvc.domain.task;

import com.eventscheduler.eventsvc.domain.model.TaskKind;

import java.util.Map;
import java.util.UUID;

/**
 * Broker message carrying one outbox task to a worker.
 */
public record TaskMessage(UUID taskId, TaskKind kind, Map<String, String> payload) {

    public String require(String field) {
        String value = payload == null ? null : payload.get(field);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Task " + taskId + " of kind " + kind + " is missing '" + field + "'");
        }
        return value;
    }
}
