package com.flowtrace.flowtrace_backend.model.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * Columns shared by every Entity Store row. A null executionId marks a manual, out-of-band row
 * that never shows up in a trace.
 */
@Getter
@Setter
@MappedSuperclass
public abstract class TaggedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "initiative_id", nullable = false)
    private UUID initiativeId;

    @Column(name = "execution_id")
    private UUID executionId;

    @Column(name = "execution_step", length = 50)
    private String executionStep;

    // Stamped by EntityStore.save; newest-first trace ordering sorts on it
    @Column(name = "created_at")
    private Instant createdAt;
}
