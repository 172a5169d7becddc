package com.conductor.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A queued mutation notice in the changefeed.
 *
 * Written by whichever backend mutated the underlying record, consumed by the
 * ControllerManager and stamped with reconciledDate once every handler for
 * (source, eventType) has completed. Reconciled rows are purged by the periodic sync.
 *
 * Example:
 *   id            = "0f5c..."
 *   source        = "Resources"
 *   sourceId      = "3a1e..."   (id of the affected resource)
 *   eventType     = CREATE
 *   reconciledDate = null       (pending)
 */
@Entity
@Table(name = "events", indexes = {
    @Index(name = "idx_events_reconciled_date", columnList = "reconciled_date")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class Event {

    @Id
    private String id;

    @Column(nullable = false)
    private String source;

    @Column(name = "source_id", nullable = false)
    private String sourceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false)
    private EventType eventType;

    @Column(name = "reconciled_date")
    private Instant reconciledDate;

    @Column(name = "created_at", nullable = false, updatable = false)
    @Builder.Default
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    @Builder.Default
    private Instant updatedAt = Instant.now();

    public boolean isReconciled() {
        return reconciledDate != null;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
