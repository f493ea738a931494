package com.flowtrace.flowtrace_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

/**
 * Tenant-scoped social presence. Every execution and entity belongs to exactly one.
 * Initiatives are created by the tenant service; this service only reads them.
 */
@Entity
@Table(name = "initiatives")
@Data
public class Initiative {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String name;

    private String description;

    private String category;

    @Column(name = "is_active")
    private boolean active = true;

    @Column(name = "created_at")
    private Instant createdAt;
}
