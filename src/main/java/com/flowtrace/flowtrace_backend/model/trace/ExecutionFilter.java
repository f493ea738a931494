package com.flowtrace.flowtrace_backend.model.trace;

import com.flowtrace.flowtrace_backend.model.domain.ExecutionStatus;

import java.util.UUID;

/** Listing filter for execution summaries. Null fields mean "any"; a null limit means the configured default. */
public record ExecutionFilter(UUID initiativeId, ExecutionStatus status, Integer limit) {

    public static ExecutionFilter all() {
        return new ExecutionFilter(null, null, null);
    }

    public static ExecutionFilter forInitiative(UUID initiativeId) {
        return new ExecutionFilter(initiativeId, null, null);
    }
}
