package com.flowtrace.flowtrace_backend.service;

import com.flowtrace.flowtrace_backend.engine.ExecutionChange;
import com.flowtrace.flowtrace_backend.engine.ExecutionEventPublisher;
import com.flowtrace.flowtrace_backend.exception.InvalidStateException;
import com.flowtrace.flowtrace_backend.exception.NotFoundException;
import com.flowtrace.flowtrace_backend.exception.ValidationException;
import com.flowtrace.flowtrace_backend.model.domain.Execution;
import com.flowtrace.flowtrace_backend.model.domain.ExecutionStatus;
import com.flowtrace.flowtrace_backend.model.domain.GuardrailViolation;
import com.flowtrace.flowtrace_backend.model.domain.StepError;
import com.flowtrace.flowtrace_backend.model.domain.StepOutcome;
import com.flowtrace.flowtrace_backend.model.domain.WorkflowType;
import com.flowtrace.flowtrace_backend.repository.ExecutionRepository;
import com.flowtrace.flowtrace_backend.repository.InitiativeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Write side of the execution ledger, called by the upstream workflow engine as each step finishes.
 * <p>
 * Status moves only {@code running -> completed} or {@code running -> failed}. A failed step fails the run at once;
 * completing every step the workflow expects completes it. After that, late or repeated signals are still
 * appended to the step, error and violation logs but never touch status or completedAt.
 * Nothing here writes to the Entity Store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionLedger {

    private final ExecutionRepository     executionRepository;
    private final InitiativeRepository    initiativeRepository;
    private final ExecutionEventPublisher eventPublisher;
    private final Clock                   clock;

    @Transactional
    public UUID startExecution(UUID initiativeId, WorkflowType workflowType) {
        return startExecution(initiativeId, workflowType, Map.of());
    }

    @Transactional
    public UUID startExecution(UUID initiativeId, WorkflowType workflowType, Map<String, Object> metadata) {
        if (initiativeId == null) {
            throw new ValidationException("initiativeId is required");
        }
        if (workflowType == null) {
            throw new ValidationException("workflowType is required");
        }
        if (!initiativeRepository.existsById(initiativeId)) {
            throw new ValidationException("Unknown initiative: " + initiativeId);
        }

        Instant now = clock.instant();
        Execution execution = new Execution();
        execution.setInitiativeId(initiativeId);
        execution.setWorkflowType(workflowType);
        execution.setStatus(ExecutionStatus.RUNNING);
        execution.setStartedAt(now);
        execution.setUpdatedAt(now);
        execution.setMetadata(metadata != null ? new HashMap<>(metadata) : new HashMap<>());
        execution = executionRepository.save(execution);

        log.info("Execution started: executionId={}, initiativeId={}, workflow={}",
                execution.getId(), initiativeId, workflowType.getSlug());
        eventPublisher.executionChanged(execution, ExecutionChange.STARTED, null);
        return execution.getId();
    }

    @Transactional
    public Execution recordStepOutcome(UUID executionId, String stepName, StepOutcome outcome, String detail) {
        if (stepName == null || stepName.isBlank()) {
            throw new ValidationException("stepName is required");
        }
        if (outcome == null) {
            throw new ValidationException("outcome is required");
        }
        Execution execution = lockExecution(executionId);
        Instant now = clock.instant();
        String step = stepName.trim();
        boolean wasTerminal = execution.getStatus().isTerminal();

        if (outcome == StepOutcome.COMPLETED) {
            appendOnce(execution.getStepsCompleted(), execution::setStepsCompleted, step);
        } else {
            appendOnce(execution.getStepsFailed(), execution::setStepsFailed, step);
            List<StepError> errors = mutable(execution.getErrorMessages());
            errors.add(new StepError(step, detail != null && !detail.isBlank() ? detail : "Step failed", now));
            execution.setErrorMessages(errors);
        }

        if (wasTerminal) {
            log.warn("Late step signal ignored for status: executionId={}, step={}, outcome={}, status={}",
                    executionId, step, outcome, execution.getStatus());
        } else if (outcome == StepOutcome.FAILED) {
            transition(execution, ExecutionStatus.FAILED, now);
        } else if (execution.getWorkflowType().isSatisfiedBy(execution.getStepsCompleted())) {
            transition(execution, ExecutionStatus.COMPLETED, now);
        }

        execution.setUpdatedAt(now);
        execution = executionRepository.save(execution);
        eventPublisher.executionChanged(execution,
                outcome == StepOutcome.COMPLETED ? ExecutionChange.STEP_COMPLETED : ExecutionChange.STEP_FAILED, step);
        return execution;
    }

    @Transactional
    public Execution recordGuardrailViolation(UUID executionId, String step, String message) {
        if (step == null || step.isBlank()) {
            throw new ValidationException("step is required");
        }
        Execution execution = lockExecution(executionId);
        Instant now = clock.instant();

        List<GuardrailViolation> violations = mutable(execution.getGuardrailViolations());
        violations.add(new GuardrailViolation(step.trim(), message != null ? message : "", now));
        execution.setGuardrailViolations(violations);
        execution.setUpdatedAt(now);
        execution = executionRepository.save(execution);

        log.warn("Guardrail violation: executionId={}, step={}, message={}", executionId, step, message);
        eventPublisher.executionChanged(execution, ExecutionChange.GUARDRAIL_VIOLATION, step.trim());
        return execution;
    }

    /**
     * Sets the terminal status and stamps completedAt. Repeating the same terminal status is a no-op;
     * a different one means the upstream engine lost track of the run and is rejected.
     */
    @Transactional
    public Execution finalizeExecution(UUID executionId, ExecutionStatus finalStatus) {
        if (finalStatus == null || !finalStatus.isTerminal()) {
            throw new ValidationException("finalStatus must be completed or failed, got " + finalStatus);
        }
        Execution execution = lockExecution(executionId);

        if (execution.getStatus().isTerminal()) {
            if (execution.getStatus() == finalStatus) {
                log.debug("Execution already {}: executionId={}", finalStatus, executionId);
                return execution;
            }
            throw new InvalidStateException("Execution " + executionId + " is already "
                    + execution.getStatus().wireName() + ", cannot finalize as " + finalStatus.wireName());
        }

        Instant now = clock.instant();
        transition(execution, finalStatus, now);
        execution.setUpdatedAt(now);
        execution = executionRepository.save(execution);
        eventPublisher.executionChanged(execution, ExecutionChange.FINALIZED, null);
        return execution;
    }

    @Transactional(readOnly = true)
    public Execution get(UUID executionId) {
        if (executionId == null) {
            throw new ValidationException("executionId is required");
        }
        return executionRepository.findById(executionId)
                .orElseThrow(() -> NotFoundException.execution(executionId));
    }

    private Execution lockExecution(UUID executionId) {
        if (executionId == null) {
            throw new ValidationException("executionId is required");
        }
        return executionRepository.findByIdForUpdate(executionId)
                .orElseThrow(() -> NotFoundException.execution(executionId));
    }

    private void transition(Execution execution, ExecutionStatus status, Instant at) {
        execution.setStatus(status);
        execution.setCompletedAt(at);
        log.info("Execution {}: executionId={}, stepsCompleted={}, stepsFailed={}",
                status.wireName(), execution.getId(), execution.getStepsCompleted(), execution.getStepsFailed());
    }

    private static void appendOnce(List<String> current, Consumer<List<String>> setter, String step) {
        List<String> steps = mutable(current);
        if (!steps.contains(step)) {
            steps.add(step);
        }
        setter.accept(steps);
    }

    // Fresh list so Hibernate sees the JSON column as dirty
    private static <T> List<T> mutable(List<T> source) {
        return source != null ? new ArrayList<>(source) : new ArrayList<>();
    }
}
