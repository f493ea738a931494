package com.flowtrace.flowtrace_backend.controller;

import com.flowtrace.flowtrace_backend.exception.ValidationException;
import com.flowtrace.flowtrace_backend.model.domain.ExecutionStatus;
import com.flowtrace.flowtrace_backend.model.domain.StepOutcome;
import com.flowtrace.flowtrace_backend.model.domain.WorkflowType;
import com.flowtrace.flowtrace_backend.model.trace.ExecutionSummary;
import com.flowtrace.flowtrace_backend.service.ExecutionLedger;
import com.flowtrace.flowtrace_backend.service.SummaryProjector;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

/**
 * Write side used by the workflow engine to report progress. Every call answers with the fresh summary.
 */
@RestController
@RequestMapping("/api/executions")
@RequiredArgsConstructor
public class ExecutionLedgerController {

    private final ExecutionLedger  ledger;
    private final SummaryProjector summaryProjector;

    // POST /api/executions: open a ledger row; returns 201 with the running summary
    @PostMapping
    public ResponseEntity<ExecutionSummary> start(@RequestBody StartExecutionRequest request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        UUID executionId = ledger.startExecution(request.initiativeId(), request.workflowType(), request.metadata());
        return ResponseEntity.status(HttpStatus.CREATED).body(summaryProjector.project(executionId));
    }

    @PostMapping("/{id}/steps")
    public ExecutionSummary recordStep(@PathVariable UUID id, @RequestBody StepOutcomeRequest request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        ledger.recordStepOutcome(id, request.step(), request.outcome(), request.detail());
        return summaryProjector.project(id);
    }

    @PostMapping("/{id}/violations")
    public ExecutionSummary recordViolation(@PathVariable UUID id, @RequestBody ViolationRequest request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        ledger.recordGuardrailViolation(id, request.step(), request.message());
        return summaryProjector.project(id);
    }

    // POST /api/executions/{id}/finalize: explicit close, e.g. when the engine aborts mid-workflow
    @PostMapping("/{id}/finalize")
    public ExecutionSummary finalizeExecution(@PathVariable UUID id, @RequestBody FinalizeRequest request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        ledger.finalizeExecution(id, request.status());
        return summaryProjector.project(id);
    }

    public record StartExecutionRequest(UUID initiativeId, WorkflowType workflowType, Map<String, Object> metadata) {}

    public record StepOutcomeRequest(String step, StepOutcome outcome, String detail) {}

    public record ViolationRequest(String step, String message) {}

    public record FinalizeRequest(ExecutionStatus status) {}
}
