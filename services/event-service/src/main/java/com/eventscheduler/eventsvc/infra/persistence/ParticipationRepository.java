package com.eventscheduler.eventsvc.infra.persistence;

import com.eventscheduler.eventsvc.domain.model.Participation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ParticipationRepository extends JpaRepository<Participation, UUID> {

    boolean existsByEventIdAndParticipantId(UUID eventId, UUID participantId);

    Optional<Participation> findByEventIdAndParticipantId(UUID eventId, UUID participantId);

    long countByEventId(UUID eventId);

    @Modifying
    @Query("DELETE FROM Participation p WHERE p.event.id = :eventId")
    int deleteByEventId(@Param("eventId") UUID eventId);
}
