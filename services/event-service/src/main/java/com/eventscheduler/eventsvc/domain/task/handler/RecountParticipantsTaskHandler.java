package com.eventscheduler.eventsvc.domain.task.handler;

import com.eventscheduler.eventsvc.domain.model.TaskKind;
import com.eventscheduler.eventsvc.domain.task.TaskHandler;
import com.eventscheduler.eventsvc.domain.task.TaskMessage;
import com.eventscheduler.eventsvc.infra.persistence.EventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.UUID;

/**
 * Recomputes the denormalized participants count for one chunk of events, ordered by id.
 * Offsets are multiples of the chunk size.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RecountParticipantsTaskHandler implements TaskHandler {

    private final EventRepository eventRepository;
    private final TransactionTemplate transactionTemplate;

    @Override
    public TaskKind kind() {
        return TaskKind.RECOUNT_PARTICIPANTS;
    }

    @Override
    public void handle(TaskMessage message) {
        int offset = Integer.parseInt(message.require("offset"));
        int limit = Integer.parseInt(message.require("limit"));
        if (limit <= 0 || offset < 0) {
            throw new IllegalArgumentException("Invalid chunk offset=" + offset + ", limit=" + limit);
        }

        Integer updated = transactionTemplate.execute(status -> {
            List<UUID> ids = eventRepository.findIdChunk(PageRequest.of(offset / limit, limit));
            return ids.isEmpty() ? 0 : eventRepository.recountParticipants(ids);
        });
        log.debug("Recounted participants: offset={}, limit={}, updated={}", offset, limit, updated);
    }
}
