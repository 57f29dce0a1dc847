package com.eventscheduler.eventsvc.domain.task;

import com.eventscheduler.eventsvc.domain.model.TaskKind;

/**
 * Executes one kind of background task. Delivery is at least once, so implementations
 * must tolerate running more than once for the same task.
 */
public interface TaskHandler {

    TaskKind kind();

    void handle(TaskMessage message) throws Exception;
}
