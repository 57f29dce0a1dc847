package com.eventscheduler.eventsvc.api.dto.response;

import java.time.Instant;

public record ParticipationResponse(String event, boolean joined, Instant joinedAt) {}
