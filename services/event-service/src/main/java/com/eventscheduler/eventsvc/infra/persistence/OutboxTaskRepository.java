package com.eventscheduler.eventsvc.infra.persistence;

import com.eventscheduler.eventsvc.domain.model.OutboxTask;
import com.eventscheduler.eventsvc.domain.model.TaskKind;
import com.eventscheduler.eventsvc.domain.model.TaskStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface OutboxTaskRepository extends JpaRepository<OutboxTask, UUID> {

    List<OutboxTask> findByStatusAndNextAttemptAtLessThanEqualOrderByCreatedAtAsc(TaskStatus status,
                                                                                    Instant now,
                                                                                    Pageable pageable);

    List<OutboxTask> findByKindOrderByCreatedAtAsc(TaskKind kind);

    long countByStatus(TaskStatus status);

    /**
     * Conditional so a worker that already completed the task is never overwritten.
     */
    @Modifying
    @Query("UPDATE OutboxTask t SET t.status = com.eventscheduler.eventsvc.domain.model.TaskStatus.DISPATCHED " +
            "WHERE t.id = :id AND t.status = com.eventscheduler.eventsvc.domain.model.TaskStatus.PENDING")
    int markDispatched(@Param("id") UUID id);

    @Modifying
    @Query("DELETE FROM OutboxTask t WHERE t.status = :status AND t.processedAt < :cutoff")
    int deleteByStatusAndProcessedAtBefore(@Param("status") TaskStatus status, @Param("cutoff") Instant cutoff);
}
