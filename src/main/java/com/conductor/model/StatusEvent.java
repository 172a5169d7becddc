package com.conductor.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Record of a status change reported by a consumer, kept for source-side
 * subscribers. A STATUS_DELETE event carries the last known payload and status
 * because the resource row itself is removed.
 */
@Entity
@Table(name = "status_events")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class StatusEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "resource_id", nullable = false)
    private String resourceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status_event_type", nullable = false)
    private StatusEventType statusEventType;

    @Column(columnDefinition = "TEXT")
    private String payload;

    @Column(columnDefinition = "TEXT")
    private String status;

    @Column(name = "created_at", nullable = false, updatable = false)
    @Builder.Default
    private Instant createdAt = Instant.now();
}
