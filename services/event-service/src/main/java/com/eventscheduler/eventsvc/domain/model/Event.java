package com.eventscheduler.eventsvc.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "events", indexes = {
        @Index(name = "idx_events_starts_at", columnList = "starts_at"),
        @Index(name = "idx_events_creator", columnList = "creator_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Event {

    static final int SHORT_TEXT_LENGTH = 50;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, unique = true, length = 80)
    private String slug;

    @Column(nullable = false, length = 256)
    private String title;

    @Column(nullable = false, length = 8192)
    private String description;

    @Column(name = "starts_at", nullable = false)
    private Instant startsAt;

    @Column(name = "ends_at")
    private Instant endsAt;

    /** Upper bound on participants; null means unlimited. */
    @Column
    private Integer capacity;

    @Column(name = "participants_count", nullable = false)
    private int participantsCount;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "creator_id", nullable = false)
    private User creator;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isPast(Instant now) {
        return startsAt.isBefore(now);
    }

    public boolean isCreatedBy(UUID userId) {
        return creator != null && creator.getId().equals(userId);
    }

    public boolean hasCapacityFor(long currentParticipants) {
        return capacity == null || currentParticipants < capacity;
    }

    public String shortTitle() {
        return title.length() <= SHORT_TEXT_LENGTH ? title : title.substring(0, SHORT_TEXT_LENGTH) + "...";
    }

    public String shortDescription() {
        return description.length() <= SHORT_TEXT_LENGTH
                ? description
                : description.substring(0, SHORT_TEXT_LENGTH) + "...";
    }
}
