package com.eventscheduler.eventsvc.domain.event;

import com.eventscheduler.eventsvc.domain.model.Event;
import com.eventscheduler.eventsvc.domain.model.User;
import com.eventscheduler.eventsvc.infra.persistence.EventRepository;
import com.eventscheduler.eventsvc.infra.persistence.ParticipationRepository;
import com.eventscheduler.eventsvc.infra.persistence.UserRepository;
import com.eventscheduler.eventsvc.infrastructure.logging.AuditEvent;
import com.eventscheduler.eventsvc.infrastructure.logging.AuditLogger;
import com.eventscheduler.eventsvc.shared.exception.EventNotFoundException;
import com.eventscheduler.eventsvc.shared.exception.ForbiddenException;
import com.eventscheduler.eventsvc.shared.exception.PastEventException;
import com.eventscheduler.eventsvc.shared.exception.UserNotVerifiedException;
import com.eventscheduler.eventsvc.shared.exception.ValidationException;
import com.eventscheduler.eventsvc.shared.security.SecurityUtils;
import com.eventscheduler.eventsvc.shared.text.SlugGenerator;
import com.eventscheduler.eventsvc.shared.validation.FieldError;
import com.eventscheduler.eventsvc.shared.validation.ValidationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Event lifecycle. Only verified users create events; only the creator changes or deletes one,
 * and only while it is still upcoming.
 */
@Service
@Slf4j
public class EventService {

    public static final int PAGE_SIZE = 25;

    private final EventRepository eventRepository;
    private final ParticipationRepository participationRepository;
    private final UserRepository userRepository;
    private final ValidationService validationService;
    private final SlugGenerator slugGenerator;
    private final AuditLogger auditLogger;
    private final SecurityUtils securityUtils;
    private final Clock clock;
    private final Integer defaultCapacity;

    public EventService(EventRepository eventRepository,
                        ParticipationRepository participationRepository,
                        UserRepository userRepository,
                        ValidationService validationService,
                        SlugGenerator slugGenerator,
                        AuditLogger auditLogger,
                        SecurityUtils securityUtils,
                        Clock clock,
                        @Value("${app.events.default-capacity:}") Integer defaultCapacity) {
        if (defaultCapacity != null && defaultCapacity < 1) {
            throw new IllegalArgumentException("app.events.default-capacity must be at least 1, got " + defaultCapacity);
        }
        this.eventRepository = eventRepository;
        this.participationRepository = participationRepository;
        this.userRepository = userRepository;
        this.validationService = validationService;
        this.slugGenerator = slugGenerator;
        this.auditLogger = auditLogger;
        this.securityUtils = securityUtils;
        this.clock = clock;
        this.defaultCapacity = defaultCapacity;
    }

    @Transactional
    public Event create(UUID creatorId, EventDraft draft) {
        User creator = userRepository.getActiveUser(creatorId);
        if (!creator.isEmailVerified()) {
            throw new UserNotVerifiedException();
        }

        // Events created without a capacity get the configured default; none configured means unlimited.
        Integer capacity = draft.capacity() != null ? draft.capacity() : defaultCapacity;
        validationService.validateEvent(draft.title(), draft.description(), draft.startsAt(), draft.endsAt(),
                capacity, clock.instant(), false).throwIfInvalid();

        String title = draft.title().trim();
        Event event = Event.builder()
                .title(title)
                .description(draft.description())
                .startsAt(draft.startsAt())
                .endsAt(draft.endsAt())
                .capacity(capacity)
                .participantsCount(0)
                .creator(creator)
                .build();
        event.setSlug(slugGenerator.generateUnique(event.shortTitle(), eventRepository::existsBySlug));
        event = eventRepository.save(event);

        auditLogger.logAudit(AuditEvent.of(
                "EVENT_CREATED", creatorId.toString(), securityUtils.getCurrentCorrelationId(),
                "Event created", Map.of("slug", event.getSlug())));
        return event;
    }

    @Transactional(readOnly = true)
    public Page<Event> list(EventListScope scope, UUID callerId, int page) {
        PageRequest pageable = PageRequest.of(Math.max(page, 0), PAGE_SIZE);
        return switch (scope) {
            case ALL -> eventRepository.findByStartsAtGreaterThanEqualOrderByStartsAtAsc(clock.instant(), pageable);
            case CREATOR -> eventRepository.findByCreatorIdOrderByStartsAtAsc(callerId, pageable);
        };
    }

    @Transactional(readOnly = true)
    public EventDetails get(String slug, UUID callerId) {
        Event event = eventRepository.findBySlug(slug).orElseThrow(() -> new EventNotFoundException(slug));
        Boolean joined = callerId == null
                ? null
                : participationRepository.existsByEventIdAndParticipantId(event.getId(), callerId);
        return new EventDetails(event, joined);
    }

    /**
     * Applies the non-null fields of {@code changes}.
     */
    @Transactional
    public Event update(UUID callerId, String slug, EventDraft changes) {
        Event event = eventRepository.findBySlugForUpdate(slug).orElseThrow(() -> new EventNotFoundException(slug));
        Instant now = clock.instant();
        requireOwnedUpcoming(event, callerId, now, "You cannot modify past events");

        Instant startsAt = changes.startsAt() != null ? changes.startsAt() : event.getStartsAt();
        Instant endsAt = changes.endsAt() != null ? changes.endsAt() : event.getEndsAt();
        validationService.validateEvent(changes.title(), changes.description(), changes.startsAt(), null,
                changes.capacity(), now, true).throwIfInvalid();
        if (endsAt != null && !endsAt.isAfter(startsAt)) {
            throw new ValidationException(FieldError.of("endsAt", "BEFORE_START", "Event must end after it starts"));
        }
        if (changes.capacity() != null && changes.capacity() < event.getParticipantsCount()) {
            throw new ValidationException(FieldError.of("capacity", "BELOW_PARTICIPANTS",
                    "Capacity cannot be lower than the current number of participants ("
                            + event.getParticipantsCount() + ")"));
        }

        if (changes.title() != null) event.setTitle(changes.title().trim());
        if (changes.description() != null) event.setDescription(changes.description());
        event.setStartsAt(startsAt);
        event.setEndsAt(endsAt);
        if (changes.capacity() != null) event.setCapacity(changes.capacity());

        auditLogger.logAudit(AuditEvent.of(
                "EVENT_UPDATED", callerId.toString(), securityUtils.getCurrentCorrelationId(),
                "Event updated", Map.of("slug", slug)));
        return event;
    }

    @Transactional
    public void delete(UUID callerId, String slug) {
        Event event = eventRepository.findBySlugForUpdate(slug).orElseThrow(() -> new EventNotFoundException(slug));
        requireOwnedUpcoming(event, callerId, clock.instant(), "You cannot delete past events");

        int removed = participationRepository.deleteByEventId(event.getId());
        eventRepository.delete(event);
        log.debug("Deleted event {} with {} participations", slug, removed);

        auditLogger.logAudit(AuditEvent.of(
                "EVENT_DELETED", callerId.toString(), securityUtils.getCurrentCorrelationId(),
                "Event deleted", Map.of("slug", slug, "participants", String.valueOf(removed))));
    }

    private static void requireOwnedUpcoming(Event event, UUID callerId, Instant now, String pastMessage) {
        if (!event.isCreatedBy(callerId)) {
            throw new ForbiddenException("Only the creator can change this event");
        }
        if (event.isPast(now)) {
            throw new PastEventException(pastMessage);
        }
    }
}
