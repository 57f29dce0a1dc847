package com.eventscheduler.eventsvc.domain.task;

import com.eventscheduler.eventsvc.domain.model.OutboxTask;
import com.eventscheduler.eventsvc.domain.model.TaskKind;
import com.eventscheduler.eventsvc.infra.persistence.OutboxTaskRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Enqueues background tasks into the outbox table within the caller's transaction, so a task
 * exists exactly when the change that caused it commits.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TaskDispatcher {

    private final OutboxTaskRepository outboxRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public TaskHandle enqueue(TaskKind kind, Map<String, String> payload) {
        String payloadJson;
        try {
            payloadJson = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize payload for task " + kind, e);
        }

        Instant now = clock.instant();
        OutboxTask task = OutboxTask.builder()
                .kind(kind)
                .payloadJson(payloadJson)
                .createdAt(now)
                .nextAttemptAt(now)
                .build();
        outboxRepository.save(task);

        log.debug("Enqueued task: id={}, kind={}", task.getId(), kind);
        return new TaskHandle(task.getId(), kind);
    }
}
