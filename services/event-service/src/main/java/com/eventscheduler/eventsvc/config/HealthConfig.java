package com.eventscheduler.eventsvc.config;

import com.eventscheduler.eventsvc.domain.model.TaskStatus;
import com.eventscheduler.eventsvc.infra.persistence.OutboxTaskRepository;
import com.eventscheduler.eventsvc.infrastructure.counter.CounterStore;
import com.eventscheduler.eventsvc.infrastructure.counter.RedisCounterStore;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@RequiredArgsConstructor
public class HealthConfig {

    private final OutboxTaskRepository outboxRepository;

    /**
     * Reports the task backlog; a backlog above the threshold usually means the relay or the broker is stuck.
     */
    @Bean
    public HealthIndicator outboxHealthIndicator(@Value("${app.outbox.backlog-warning:1000}") long backlogWarning) {
        return () -> {
            long pending = outboxRepository.countByStatus(TaskStatus.PENDING);
            long failed = outboxRepository.countByStatus(TaskStatus.FAILED);
            Health.Builder builder = pending > backlogWarning ? Health.status("DEGRADED") : Health.up();
            return builder
                    .withDetail("pending", pending)
                    .withDetail("failed", failed)
                    .build();
        };
    }

    @Bean
    public HealthIndicator rateLimitStoreHealthIndicator(@Qualifier("rateLimitCounterStore") CounterStore store) {
        return () -> {
            if (store instanceof RedisCounterStore redis) {
                CircuitBreaker.State state = redis.circuitState();
                Health.Builder builder = state == CircuitBreaker.State.OPEN ? Health.status("DEGRADED") : Health.up();
                return builder.withDetail("store", store.name()).withDetail("circuit", state.name()).build();
            }
            return Health.up().withDetail("store", store.name()).build();
        };
    }
}
