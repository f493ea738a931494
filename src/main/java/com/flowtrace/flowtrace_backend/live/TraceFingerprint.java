package com.flowtrace.flowtrace_backend.live;

import com.flowtrace.flowtrace_backend.model.domain.ExecutionStatus;
import com.flowtrace.flowtrace_backend.model.trace.EntityCounts;
import com.flowtrace.flowtrace_backend.model.trace.ExecutionSummary;
import com.flowtrace.flowtrace_backend.model.trace.ExecutionTrace;

import java.util.List;

/** The parts of a trace whose change is worth a callback. */
record TraceFingerprint(ExecutionStatus status,
                        EntityCounts counts,
                        List<String> stepsCompleted,
                        List<String> stepsFailed,
                        int errorCount,
                        int violationCount) {

    static TraceFingerprint of(ExecutionTrace trace) {
        ExecutionSummary summary = trace.summary();
        return new TraceFingerprint(
                summary.status(),
                summary.counts(),
                List.copyOf(summary.stepsCompleted()),
                List.copyOf(summary.stepsFailed()),
                summary.errorMessages().size(),
                summary.guardrailViolations().size());
    }
}
