package com.eventscheduler.eventsvc.api.controller;

import com.eventscheduler.eventsvc.api.dto.request.EventCreateRequest;
import com.eventscheduler.eventsvc.api.dto.request.EventUpdateRequest;
import com.eventscheduler.eventsvc.api.dto.response.EventDetailResponse;
import com.eventscheduler.eventsvc.api.dto.response.EventPageResponse;
import com.eventscheduler.eventsvc.api.dto.response.ParticipationResponse;
import com.eventscheduler.eventsvc.domain.event.EventDraft;
import com.eventscheduler.eventsvc.domain.event.EventListScope;
import com.eventscheduler.eventsvc.domain.event.EventService;
import com.eventscheduler.eventsvc.domain.model.Event;
import com.eventscheduler.eventsvc.domain.model.Participation;
import com.eventscheduler.eventsvc.domain.participation.ParticipationService;
import com.eventscheduler.eventsvc.shared.exception.ValidationException;
import com.eventscheduler.eventsvc.shared.security.SecurityUtils;
import com.eventscheduler.eventsvc.shared.validation.FieldError;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/events")
@RequiredArgsConstructor
@Tag(name = "Events", description = "Event management and participation")
public class EventController {

    private final EventService eventService;
    private final ParticipationService participationService;
    private final SecurityUtils securityUtils;

    @GetMapping
    @Operation(summary = "List events",
            description = "scope=all lists upcoming events, scope=creator lists the caller's own events")
    @ApiResponse(responseCode = "200", description = "Page of events")
    @ApiResponse(responseCode = "400", description = "Unknown scope")
    @ApiResponse(responseCode = "401", description = "scope=creator without authentication")
    public ResponseEntity<EventPageResponse> list(@RequestParam(required = false) String scope,
                                                  @RequestParam(defaultValue = "0") int page) {
        EventListScope listScope = EventListScope.parse(scope).orElseThrow(() -> new ValidationException(
                FieldError.of("scope", "INVALID", "scope must be one of: all, creator")));
        UUID callerId = listScope == EventListScope.CREATOR
                ? securityUtils.requireCurrentUserId()
                : securityUtils.currentUserId().orElse(null);
        return ResponseEntity.ok(EventPageResponse.from(eventService.list(listScope, callerId, page)));
    }

    @PostMapping
    @SecurityRequirement(name = "bearer-jwt")
    @Operation(summary = "Create an event", description = "Only verified users can create events")
    @ApiResponse(responseCode = "201", description = "Event created")
    @ApiResponse(responseCode = "400", description = "Validation error")
    @ApiResponse(responseCode = "403", description = "Email not verified")
    public ResponseEntity<EventDetailResponse> create(@Valid @RequestBody EventCreateRequest request) {
        UUID userId = securityUtils.requireCurrentUserId();
        Event event = eventService.create(userId, new EventDraft(
                request.title(), request.description(), request.startsAt(), request.endsAt(), request.capacity()));
        return ResponseEntity.status(HttpStatus.CREATED).body(EventDetailResponse.from(event, false));
    }

    @GetMapping("/{slug}")
    @Operation(summary = "Get event details")
    @ApiResponse(responseCode = "200", description = "Event found")
    @ApiResponse(responseCode = "404", description = "Event not found")
    public ResponseEntity<EventDetailResponse> get(@PathVariable String slug) {
        UUID callerId = securityUtils.currentUserId().orElse(null);
        return ResponseEntity.ok(EventDetailResponse.from(eventService.get(slug, callerId)));
    }

    @PatchMapping("/{slug}")
    @SecurityRequirement(name = "bearer-jwt")
    @Operation(summary = "Update an upcoming event", description = "Only the creator can update")
    @ApiResponse(responseCode = "200", description = "Event updated")
    @ApiResponse(responseCode = "403", description = "Not the creator")
    @ApiResponse(responseCode = "404", description = "Event not found")
    @ApiResponse(responseCode = "409", description = "Event already started")
    public ResponseEntity<EventDetailResponse> update(@PathVariable String slug,
                                                      @RequestBody EventUpdateRequest request) {
        UUID userId = securityUtils.requireCurrentUserId();
        Event event = eventService.update(userId, slug, new EventDraft(
                request.title(), request.description(), request.startsAt(), request.endsAt(), request.capacity()));
        return ResponseEntity.ok(EventDetailResponse.from(event, null));
    }

    @DeleteMapping("/{slug}")
    @SecurityRequirement(name = "bearer-jwt")
    @Operation(summary = "Delete an event", description = "Only the creator can delete")
    @ApiResponse(responseCode = "204", description = "Event deleted")
    @ApiResponse(responseCode = "403", description = "Not the creator")
    public ResponseEntity<Void> delete(@PathVariable String slug) {
        eventService.delete(securityUtils.requireCurrentUserId(), slug);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{slug}/participants")
    @SecurityRequirement(name = "bearer-jwt")
    @Operation(summary = "Join an event")
    @ApiResponse(responseCode = "201", description = "Joined")
    @ApiResponse(responseCode = "409", description = "Already joined or event full")
    public ResponseEntity<ParticipationResponse> join(@PathVariable String slug) {
        Participation participation = participationService.join(securityUtils.requireCurrentUserId(), slug);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new ParticipationResponse(slug, true, participation.getJoinedAt()));
    }

    @DeleteMapping("/{slug}/participants")
    @SecurityRequirement(name = "bearer-jwt")
    @Operation(summary = "Withdraw from an event")
    @ApiResponse(responseCode = "204", description = "Withdrawn")
    @ApiResponse(responseCode = "404", description = "Not a participant")
    public ResponseEntity<Void> withdraw(@PathVariable String slug) {
        participationService.withdraw(securityUtils.requireCurrentUserId(), slug);
        return ResponseEntity.noContent().build();
    }
}
