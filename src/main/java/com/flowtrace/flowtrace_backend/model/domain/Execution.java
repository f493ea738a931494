package com.flowtrace.flowtrace_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Ledger row for one workflow run. Only {@code ExecutionLedger} mutates it; once the status is terminal
 * the status and completedAt never change again, while the step, error and violation logs stay append-only.
 */
@Entity
@Table(name = "execution_logs")
@Data
public class Execution {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "execution_id")
    private UUID id;

    @Column(name = "initiative_id", nullable = false)
    private UUID initiativeId;

    @Enumerated(EnumType.STRING)
    @Column(name = "workflow_type", nullable = false)
    private WorkflowType workflowType;

    @Enumerated(EnumType.STRING)
    private ExecutionStatus status = ExecutionStatus.RUNNING;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "steps_completed")
    private List<String> stepsCompleted = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "steps_failed")
    private List<String> stepsFailed = new ArrayList<>();

    // {step, message, timestamp} per failed step outcome, including late or repeated ones
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "error_messages")
    private List<StepError> errorMessages = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "guardrail_violations")
    private List<GuardrailViolation> guardrailViolations = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> metadata = new HashMap<>();

    @Column(name = "updated_at")
    private Instant updatedAt;
}
