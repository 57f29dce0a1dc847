package com.eventscheduler.eventsvc.infrastructure.outbox;

import com.eventscheduler.eventsvc.domain.model.OutboxTask;
import com.eventscheduler.eventsvc.domain.model.TaskStatus;
import com.eventscheduler.eventsvc.domain.task.TaskMessage;
import com.eventscheduler.eventsvc.infra.persistence.OutboxTaskRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Relays due outbox tasks to the task topic. Each send is awaited so a task is only marked
 * DISPATCHED once the broker acknowledged it; failed sends are rescheduled with exponential backoff.
 */
@Component
@ConditionalOnProperty(prefix = "app.outbox", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class OutboxRelay {

    static final int BATCH_SIZE = 100;

    private static final TypeReference<Map<String, String>> PAYLOAD_TYPE = new TypeReference<>() { };

    private final OutboxTaskRepository outboxRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String topic;
    private final int maxRetries;
    private final Duration sendTimeout;
    private final Duration initialBackoff;
    private final Duration maxBackoff;

    public OutboxRelay(OutboxTaskRepository outboxRepository,
                       KafkaTemplate<String, String> kafkaTemplate,
                       ObjectMapper objectMapper,
                       Clock clock,
                       @Value("${app.tasks.topic:event-scheduler.tasks}") String topic,
                       @Value("${app.tasks.max-retries:3}") int maxRetries,
                       @Value("${app.outbox.send-timeout:PT10S}") Duration sendTimeout,
                       @Value("${app.outbox.initial-backoff:PT2S}") Duration initialBackoff,
                       @Value("${app.outbox.max-backoff:PT5M}") Duration maxBackoff) {
        this.outboxRepository = outboxRepository;
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.topic = topic;
        this.maxRetries = maxRetries;
        this.sendTimeout = sendTimeout;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
    }

    @Scheduled(fixedDelayString = "${app.outbox.poll-interval-ms:1000}")
    @Transactional
    public void relayPendingTasks() {
        List<OutboxTask> tasks = outboxRepository.findByStatusAndNextAttemptAtLessThanEqualOrderByCreatedAtAsc(
                TaskStatus.PENDING, clock.instant(), PageRequest.of(0, BATCH_SIZE));

        if (tasks.isEmpty()) {
            return;
        }

        log.debug("Relaying {} outbox tasks", tasks.size());

        for (OutboxTask task : tasks) {
            relay(task);
        }
    }

    private void relay(OutboxTask task) {
        try {
            Map<String, String> payload = objectMapper.readValue(task.getPayloadJson(), PAYLOAD_TYPE);
            String message = objectMapper.writeValueAsString(new TaskMessage(task.getId(), task.getKind(), payload));

            kafkaTemplate.send(topic, task.getId().toString(), message)
                    .get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);

            outboxRepository.markDispatched(task.getId());
            log.debug("Task sent to Kafka: taskId={}, kind={}", task.getId(), task.getKind());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(task, "Interrupted while sending");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            recordFailure(task, cause.getMessage());
        } catch (TimeoutException e) {
            recordFailure(task, "Timed out after " + sendTimeout);
        } catch (Exception e) {
            recordFailure(task, e.getMessage());
        }
    }

    private void recordFailure(OutboxTask task, String error) {
        Instant now = clock.instant();
        Instant nextAttempt = now.plus(backoffFor(task.getRetryCount()));
        task.recordFailure(error, now, nextAttempt, maxRetries);

        if (task.getStatus() == TaskStatus.FAILED) {
            log.error("Giving up on outbox task after {} attempts: taskId={}, kind={}, error={}",
                    task.getRetryCount(), task.getId(), task.getKind(), error);
        } else {
            log.warn("Failed to send outbox task, retrying at {}: taskId={}, attempt={}, error={}",
                    nextAttempt, task.getId(), task.getRetryCount(), error);
        }
    }

    Duration backoffFor(int retryCount) {
        long factor = 1L << Math.min(retryCount, 20);
        Duration backoff = initialBackoff.multipliedBy(factor);
        return backoff.compareTo(maxBackoff) > 0 ? maxBackoff : backoff;
    }
}
