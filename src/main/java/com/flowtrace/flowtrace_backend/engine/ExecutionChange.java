package com.flowtrace.flowtrace_backend.engine;

public enum ExecutionChange {
    STARTED,
    STEP_COMPLETED,
    STEP_FAILED,
    GUARDRAIL_VIOLATION,
    FINALIZED
}
