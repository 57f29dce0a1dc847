package com.eventscheduler.eventsvc.domain.task;

import java.util.UUID;

/**
 * A task handler failed or exceeded its time limit. Retried by the worker's error handler.
 */
public class TaskExecutionException extends RuntimeException {

    private final UUID taskId;

    public TaskExecutionException(UUID taskId, String message, Throwable cause) {
        super(message, cause);
        this.taskId = taskId;
    }

    public UUID getTaskId() {
        return taskId;
    }
}
