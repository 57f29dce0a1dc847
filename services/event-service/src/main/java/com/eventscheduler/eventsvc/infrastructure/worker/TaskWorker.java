package com.eventscheduler.eventsvc.infrastructure.worker;

import com.eventscheduler.eventsvc.domain.model.OutboxTask;
import com.eventscheduler.eventsvc.domain.model.TaskKind;
import com.eventscheduler.eventsvc.domain.model.TaskStatus;
import com.eventscheduler.eventsvc.domain.task.TaskExecutionException;
import com.eventscheduler.eventsvc.domain.task.TaskHandler;
import com.eventscheduler.eventsvc.domain.task.TaskMessage;
import com.eventscheduler.eventsvc.infra.persistence.OutboxTaskRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Consumes task messages and runs the matching handler on a bounded executor with a time limit.
 * Tasks already COMPLETED are skipped, which makes broker redelivery harmless.
 */
@Component
public class TaskWorker {

    private static final Logger log = LoggerFactory.getLogger(TaskWorker.class);

    private final Map<TaskKind, TaskHandler> handlers = new EnumMap<>(TaskKind.class);
    private final OutboxTaskRepository outboxRepository;
    private final ObjectMapper objectMapper;
    private final ExecutorService executor;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final Duration timeout;
    private final Counter taskCompletedCounter;
    private final Counter taskFailedCounter;

    public TaskWorker(List<TaskHandler> taskHandlers,
                      OutboxTaskRepository outboxRepository,
                      ObjectMapper objectMapper,
                      @Qualifier("taskHandlerExecutor") ExecutorService executor,
                      TransactionTemplate transactionTemplate,
                      Clock clock,
                      @Value("${app.tasks.timeout:PT30S}") Duration timeout,
                      @Qualifier("taskCompletedCounter") Counter taskCompletedCounter,
                      @Qualifier("taskFailedCounter") Counter taskFailedCounter) {
        for (TaskHandler handler : taskHandlers) {
            TaskHandler previous = handlers.put(handler.kind(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handlers for task kind " + handler.kind());
            }
        }
        this.outboxRepository = outboxRepository;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
        this.timeout = timeout;
        this.taskCompletedCounter = taskCompletedCounter;
        this.taskFailedCounter = taskFailedCounter;
    }

    @KafkaListener(
            id = "taskWorker",
            topics = "${app.tasks.topic:event-scheduler.tasks}",
            groupId = "${app.tasks.consumer-group:event-service-workers}",
            autoStartup = "${app.tasks.worker.auto-startup:true}")
    public void onMessage(String json) throws JsonProcessingException {
        process(objectMapper.readValue(json, TaskMessage.class));
    }

    /**
     * Runs the task unless it already completed.
     *
     * @return true if the handler ran, false if the task was skipped
     * @throws TaskExecutionException if the handler failed or timed out
     */
    public boolean process(TaskMessage message) {
        Optional<OutboxTask> stored = outboxRepository.findById(message.taskId());
        if (stored.isEmpty()) {
            log.warn("Received unknown task, ignoring: taskId={}, kind={}", message.taskId(), message.kind());
            return false;
        }
        TaskStatus status = stored.get().getStatus();
        if (status == TaskStatus.COMPLETED || status == TaskStatus.FAILED) {
            log.debug("Skipping task in terminal state: taskId={}, status={}", message.taskId(), status);
            return false;
        }

        TaskHandler handler = handlers.get(message.kind());
        if (handler == null) {
            throw new IllegalStateException("No handler for task kind " + message.kind());
        }

        runWithTimeout(handler, message);

        transactionTemplate.executeWithoutResult(tx -> outboxRepository.findById(message.taskId())
                .ifPresent(task -> task.markCompleted(clock.instant())));
        taskCompletedCounter.increment();
        log.debug("Task completed: taskId={}, kind={}", message.taskId(), message.kind());
        return true;
    }

    /**
     * Marks a task FAILED once retries are exhausted.
     */
    public void markFailed(UUID taskId, Throwable cause) {
        String error = cause == null ? "unknown" : cause.getMessage();
        transactionTemplate.executeWithoutResult(tx -> outboxRepository.findById(taskId)
                .ifPresent(task -> task.markFailed(error, clock.instant())));
        taskFailedCounter.increment();
        log.error("Task failed after exhausting retries: taskId={}, error={}", taskId, error, cause);
    }

    private void runWithTimeout(TaskHandler handler, TaskMessage message) {
        Future<?> future = executor.submit(() -> {
            handler.handle(message);
            return null;
        });
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TaskExecutionException(message.taskId(),
                    "Task " + message.taskId() + " timed out after " + timeout, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new TaskExecutionException(message.taskId(),
                    "Task " + message.taskId() + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TaskExecutionException(message.taskId(), "Interrupted while running task " + message.taskId(), e);
        }
    }
}
