package com.flowtrace.flowtrace_backend.model.trace;

import com.flowtrace.flowtrace_backend.model.domain.ExecutionStatus;
import com.flowtrace.flowtrace_backend.model.domain.GuardrailViolation;
import com.flowtrace.flowtrace_backend.model.domain.StepError;
import com.flowtrace.flowtrace_backend.model.domain.WorkflowType;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read-only projection of one execution: ledger fields plus live counts of the rows it produced.
 * Always recomputed; never stored.
 */
public record ExecutionSummary(
        UUID                     executionId,
        UUID                     initiativeId,
        WorkflowType             workflowType,
        ExecutionStatus          status,
        Instant                  startedAt,
        Instant                  completedAt,
        double                   durationSeconds,
        long                     campaignsCreated,
        long                     adSetsCreated,
        long                     postsCreated,
        long                     researchEntries,
        long                     mediaFilesCreated,
        List<String>             stepsCompleted,
        List<String>             stepsFailed,
        List<StepError>          errorMessages,
        List<GuardrailViolation> guardrailViolations,
        Map<String, Object>      metadata
) {

    public EntityCounts counts() {
        return new EntityCounts(campaignsCreated, adSetsCreated, postsCreated, researchEntries, mediaFilesCreated);
    }
}
