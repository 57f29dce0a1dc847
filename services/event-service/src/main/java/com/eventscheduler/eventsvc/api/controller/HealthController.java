package com.eventscheduler.eventsvc.api.controller;

import com.eventscheduler.eventsvc.domain.model.TaskStatus;
import com.eventscheduler.eventsvc.infra.persistence.OutboxTaskRepository;
import com.eventscheduler.eventsvc.infrastructure.counter.CounterStore;
import com.eventscheduler.eventsvc.infrastructure.counter.RedisCounterStore;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.HashMap;
import java.util.Map;

@RestController
@Tag(name = "Health", description = "Health check endpoints")
public class HealthController {

    private final DataSource dataSource;
    private final OutboxTaskRepository outboxTaskRepository;
    private final CounterStore counterStore;

    public HealthController(DataSource dataSource,
                            OutboxTaskRepository outboxTaskRepository,
                            @Qualifier("rateLimitCounterStore") CounterStore counterStore) {
        this.dataSource = dataSource;
        this.outboxTaskRepository = outboxTaskRepository;
        this.counterStore = counterStore;
    }

    @GetMapping("/health")
    @Operation(summary = "Basic health check")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }

    @GetMapping("/health/ready")
    @Operation(summary = "Readiness check", description = "Checks database, rate limit store and task backlog")
    public ResponseEntity<Map<String, Object>> ready() {
        Map<String, Object> health = new HashMap<>();
        boolean allHealthy = true;

        try (Connection conn = dataSource.getConnection()) {
            health.put("database", Map.of("status", "UP"));
            health.put("tasks", Map.of(
                    "pending", outboxTaskRepository.countByStatus(TaskStatus.PENDING),
                    "failed", outboxTaskRepository.countByStatus(TaskStatus.FAILED)));
        } catch (Exception e) {
            health.put("database", Map.of("status", "DOWN", "error", String.valueOf(e.getMessage())));
            allHealthy = false;
        }

        // An open circuit is not fatal: counting falls back to the local store
        if (counterStore instanceof RedisCounterStore redis && redis.circuitState() == CircuitBreaker.State.OPEN) {
            health.put("rateLimitStore", Map.of("status", "DOWN", "fallback", "local"));
        } else {
            health.put("rateLimitStore", Map.of("status", "UP", "store", counterStore.name()));
        }

        health.put("status", allHealthy ? "UP" : "DOWN");

        return ResponseEntity.status(allHealthy ? 200 : 503).body(health);
    }
}
