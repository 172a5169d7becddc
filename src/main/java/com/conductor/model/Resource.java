package com.conductor.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A changefeed-backed resource: the desired spec for one consumer (cluster)
 * plus the last status that consumer reported.
 *
 * payload and status are JSON documents stored as text; the service layer
 * never interprets the spec, it only relays it.
 */
@Entity
@Table(name = "resources")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class Resource {

    @Id
    private String id;

    @Column(name = "consumer_name", nullable = false)
    private String consumerName;

    @Column(nullable = false)
    @Builder.Default
    private long version = 1;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String payload;

    @Column(columnDefinition = "TEXT")
    private String status;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    @Builder.Default
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    @Builder.Default
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
