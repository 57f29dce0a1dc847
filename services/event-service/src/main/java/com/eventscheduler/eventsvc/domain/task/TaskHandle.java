package com.eventscheduler.eventsvc.domain.task;

import com.eventscheduler.eventsvc.domain.model.TaskKind;

import java.util.UUID;

public record TaskHandle(UUID id, TaskKind kind) {
}
