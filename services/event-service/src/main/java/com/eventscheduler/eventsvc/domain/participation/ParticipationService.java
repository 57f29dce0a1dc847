package com.eventscheduler.eventsvc.domain.participation;

import com.eventscheduler.eventsvc.domain.model.Event;
import com.eventscheduler.eventsvc.domain.model.Participation;
import com.eventscheduler.eventsvc.domain.model.User;
import com.eventscheduler.eventsvc.infra.persistence.EventRepository;
import com.eventscheduler.eventsvc.infra.persistence.ParticipationRepository;
import com.eventscheduler.eventsvc.infra.persistence.UserRepository;
import com.eventscheduler.eventsvc.shared.exception.AlreadyJoinedException;
import com.eventscheduler.eventsvc.shared.exception.CapacityExceededException;
import com.eventscheduler.eventsvc.shared.exception.EventNotFoundException;
import com.eventscheduler.eventsvc.shared.exception.NotAParticipantException;
import io.micrometer.core.instrument.Counter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;

/**
 * Join and withdraw. Both lock the event row first, so the membership check, the capacity check
 * and the write see a consistent participant count; the unique (event, participant) constraint
 * backs up the membership check.
 */
@Service
@Slf4j
public class ParticipationService {

    private final EventRepository eventRepository;
    private final ParticipationRepository participationRepository;
    private final UserRepository userRepository;
    private final Clock clock;
    private final Counter joinCounter;

    public ParticipationService(EventRepository eventRepository,
                                ParticipationRepository participationRepository,
                                UserRepository userRepository,
                                Clock clock,
                                @Qualifier("joinCounter") Counter joinCounter) {
        this.eventRepository = eventRepository;
        this.participationRepository = participationRepository;
        this.userRepository = userRepository;
        this.clock = clock;
        this.joinCounter = joinCounter;
    }

    /**
     * @throws EventNotFoundException if no event has this slug
     * @throws AlreadyJoinedException if the user already takes part
     * @throws CapacityExceededException if the event is full
     */
    @Transactional
    public Participation join(UUID userId, String slug) {
        User user = userRepository.getActiveUser(userId);
        Event event = eventRepository.findBySlugForUpdate(slug).orElseThrow(() -> new EventNotFoundException(slug));

        if (participationRepository.existsByEventIdAndParticipantId(event.getId(), userId)) {
            throw new AlreadyJoinedException();
        }
        long current = participationRepository.countByEventId(event.getId());
        if (!event.hasCapacityFor(current)) {
            throw new CapacityExceededException();
        }

        Participation participation = Participation.builder()
                .event(event)
                .participant(user)
                .joinedAt(clock.instant())
                .build();
        try {
            participation = participationRepository.saveAndFlush(participation);
        } catch (DataIntegrityViolationException e) {
            throw new AlreadyJoinedException();
        }
        event.setParticipantsCount((int) current + 1);

        joinCounter.increment();
        log.debug("User {} joined event {}", userId, slug);
        return participation;
    }

    /**
     * @throws NotAParticipantException if the user does not take part; nothing changes in that case
     */
    @Transactional
    public void withdraw(UUID userId, String slug) {
        userRepository.getActiveUser(userId);
        Event event = eventRepository.findBySlugForUpdate(slug).orElseThrow(() -> new EventNotFoundException(slug));

        Participation participation = participationRepository.findByEventIdAndParticipantId(event.getId(), userId)
                .orElseThrow(NotAParticipantException::new);
        participationRepository.delete(participation);
        participationRepository.flush();

        event.setParticipantsCount((int) participationRepository.countByEventId(event.getId()));
        log.debug("User {} withdrew from event {}", userId, slug);
    }
}
