package com.conductor.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A registered consumer, i.e. a cluster that may receive changefeed-backed resources.
 */
@Entity
@Table(name = "consumers")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class Consumer {

    @Id
    private String name;

    @Column(name = "created_at", nullable = false, updatable = false)
    @Builder.Default
    private Instant createdAt = Instant.now();
}
