package com.flowtrace.flowtrace_backend.engine;

import com.flowtrace.flowtrace_backend.model.domain.ExecutionStatus;

import java.util.UUID;

/** Published for every ledger mutation; delivered to listeners after the ledger transaction commits. */
public record ExecutionChangedEvent(UUID executionId, ExecutionStatus status, ExecutionChange change, String step) {}
