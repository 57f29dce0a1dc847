package com.eventscheduler.eventsvc.infra.persistence;

import com.eventscheduler.eventsvc.domain.model.Event;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface EventRepository extends JpaRepository<Event, UUID> {

    @Query("SELECT e FROM Event e JOIN FETCH e.creator WHERE e.slug = :slug")
    Optional<Event> findBySlug(@Param("slug") String slug);

    /**
     * Locks the event row for the rest of the transaction. Concurrent joins on the same event serialize here.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM Event e WHERE e.slug = :slug")
    Optional<Event> findBySlugForUpdate(@Param("slug") String slug);

    boolean existsBySlug(String slug);

    Page<Event> findByStartsAtGreaterThanEqualOrderByStartsAtAsc(Instant from, Pageable pageable);

    Page<Event> findByCreatorIdOrderByStartsAtAsc(UUID creatorId, Pageable pageable);

    @Query("SELECT e.id FROM Event e ORDER BY e.id")
    List<UUID> findIdChunk(Pageable pageable);

    @Modifying
    @Query("UPDATE Event e SET e.participantsCount = " +
            "(SELECT COUNT(p) FROM Participation p WHERE p.event.id = e.id) WHERE e.id IN :ids")
    int recountParticipants(@Param("ids") List<UUID> ids);
}
