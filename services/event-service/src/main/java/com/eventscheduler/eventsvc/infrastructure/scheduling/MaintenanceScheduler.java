package com.eventscheduler.eventsvc.infrastructure.scheduling;

import com.eventscheduler.eventsvc.domain.model.TaskKind;
import com.eventscheduler.eventsvc.domain.model.TaskStatus;
import com.eventscheduler.eventsvc.domain.task.TaskDispatcher;
import com.eventscheduler.eventsvc.infra.persistence.EventRepository;
import com.eventscheduler.eventsvc.infra.persistence.OutboxTaskRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Periodic jobs that run regardless of request traffic. Work is enqueued as tasks so it goes
 * through the same retry and timeout handling as any other background task.
 */
@Component
@ConditionalOnProperty(prefix = "app.maintenance", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class MaintenanceScheduler {

    private final TaskDispatcher taskDispatcher;
    private final EventRepository eventRepository;
    private final OutboxTaskRepository outboxRepository;
    private final Clock clock;
    private final int recountChunkSize;
    private final Duration outboxRetention;

    public MaintenanceScheduler(TaskDispatcher taskDispatcher,
                                EventRepository eventRepository,
                                OutboxTaskRepository outboxRepository,
                                Clock clock,
                                @Value("${app.maintenance.recount-chunk-size:2000}") int recountChunkSize,
                                @Value("${app.maintenance.outbox-retention:P7D}") Duration outboxRetention) {
        this.taskDispatcher = taskDispatcher;
        this.eventRepository = eventRepository;
        this.outboxRepository = outboxRepository;
        this.clock = clock;
        this.recountChunkSize = recountChunkSize;
        this.outboxRetention = outboxRetention;
    }

    @Scheduled(cron = "${app.maintenance.recount-cron:0 */30 * * * *}")
    @Transactional
    public void scheduleParticipantRecount() {
        long events = eventRepository.count();
        int chunks = 0;
        for (long offset = 0; offset < events; offset += recountChunkSize) {
            taskDispatcher.enqueue(TaskKind.RECOUNT_PARTICIPANTS, Map.of(
                    "offset", String.valueOf(offset),
                    "limit", String.valueOf(recountChunkSize)));
            chunks++;
        }
        log.info("Scheduled participant recount: events={}, chunks={}", events, chunks);
    }

    @Scheduled(cron = "${app.maintenance.purge-cron:0 0 * * * *}")
    @Transactional
    public void schedulePurge() {
        taskDispatcher.enqueue(TaskKind.PURGE_EXPIRED_TOKENS, Map.of());
        int deleted = outboxRepository.deleteByStatusAndProcessedAtBefore(
                TaskStatus.COMPLETED, clock.instant().minus(outboxRetention));
        log.info("Scheduled token purge, removed {} completed outbox tasks", deleted);
    }
}
