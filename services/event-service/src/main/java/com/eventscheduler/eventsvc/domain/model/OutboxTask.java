package com.eventscheduler.eventsvc.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Durable background task. Written in the same transaction as the change that caused it,
 * relayed to the broker, and executed by a worker at least once.
 */
@Entity
@Table(name = "outbox_tasks", indexes = {
        @Index(name = "idx_outbox_tasks_status_next_attempt", columnList = "status, next_attempt_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OutboxTask {

    static final int MAX_ERROR_LENGTH = 1000;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private TaskKind kind;

    @Column(name = "payload_json", nullable = false, length = 4000)
    private String payloadJson;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TaskStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "next_attempt_at", nullable = false)
    private Instant nextAttemptAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "last_error", length = MAX_ERROR_LENGTH)
    private String lastError;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (nextAttemptAt == null) {
            nextAttemptAt = createdAt;
        }
        if (status == null) {
            status = TaskStatus.PENDING;
        }
    }

    public boolean isCompleted() {
        return status == TaskStatus.COMPLETED;
    }

    public void markCompleted(Instant now) {
        this.status = TaskStatus.COMPLETED;
        this.processedAt = now;
        this.lastError = null;
    }

    /**
     * Records a failed attempt and schedules the next one, or marks the task FAILED
     * when {@code maxRetries} attempts have been used.
     */
    public void recordFailure(String error, Instant now, Instant nextAttempt, int maxRetries) {
        this.retryCount++;
        this.lastError = truncate(error);
        if (retryCount >= maxRetries) {
            this.status = TaskStatus.FAILED;
            this.processedAt = now;
        } else {
            this.status = TaskStatus.PENDING;
            this.nextAttemptAt = nextAttempt;
        }
    }

    public void markFailed(String error, Instant now) {
        this.status = TaskStatus.FAILED;
        this.lastError = truncate(error);
        this.processedAt = now;
    }

    private static String truncate(String error) {
        if (error == null) return null;
        return error.length() <= MAX_ERROR_LENGTH ? error : error.substring(0, MAX_ERROR_LENGTH);
    }
}
