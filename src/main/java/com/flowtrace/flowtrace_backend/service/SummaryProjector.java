package com.flowtrace.flowtrace_backend.service;

import com.flowtrace.flowtrace_backend.config.FlowtraceProperties;
import com.flowtrace.flowtrace_backend.exception.NotFoundException;
import com.flowtrace.flowtrace_backend.exception.ValidationException;
import com.flowtrace.flowtrace_backend.model.domain.EntityKind;
import com.flowtrace.flowtrace_backend.model.domain.Execution;
import com.flowtrace.flowtrace_backend.model.trace.EntityCounts;
import com.flowtrace.flowtrace_backend.model.trace.ExecutionFilter;
import com.flowtrace.flowtrace_backend.model.trace.ExecutionSummary;
import com.flowtrace.flowtrace_backend.repository.ExecutionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Builds {@link ExecutionSummary} views from a ledger row plus live Entity Store counts.
 * Counts are always recomputed, so a summary is never stale relative to the store at the moment of the call.
 */
@Slf4j
@Service
public class SummaryProjector {

    private final ExecutionRepository executionRepository;
    private final EntityStore         entityStore;
    private final Executor            fetchExecutor;
    private final FlowtraceProperties properties;
    private final Clock               clock;

    public SummaryProjector(ExecutionRepository executionRepository,
                            EntityStore entityStore,
                            @Qualifier("traceFetchExecutor") Executor fetchExecutor,
                            FlowtraceProperties properties,
                            Clock clock) {
        this.executionRepository = executionRepository;
        this.entityStore = entityStore;
        this.fetchExecutor = fetchExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    public ExecutionSummary project(UUID executionId) {
        return Futures.join(projectAsync(executionId));
    }

    /**
     * Loads the ledger row, then runs the five counts concurrently. Completes exceptionally with
     * {@link NotFoundException} when the execution does not exist. Nothing here blocks a pool thread.
     */
    public CompletableFuture<ExecutionSummary> projectAsync(UUID executionId) {
        if (executionId == null) {
            return CompletableFuture.failedFuture(new ValidationException("executionId is required"));
        }
        return withTimeout(Futures.supplyAsync(() -> executionRepository.findById(executionId)
                        .orElseThrow(() -> NotFoundException.execution(executionId)), fetchExecutor))
                .thenCompose(execution -> countsFor(executionId)
                        .thenApply(counts -> toSummary(execution, counts)));
    }

    /**
     * Newest-started first, at most one page. Counts come from one grouped query per kind for the whole page
     * rather than five queries per row.
     */
    public List<ExecutionSummary> projectMany(ExecutionFilter filter) {
        ExecutionFilter effective = filter != null ? filter : ExecutionFilter.all();
        Pageable page = PageRequest.of(0, clampLimit(effective.limit()));

        List<Execution> executions;
        if (effective.initiativeId() != null && effective.status() != null) {
            executions = executionRepository.findByInitiativeIdAndStatusOrderByStartedAtDesc(
                    effective.initiativeId(), effective.status(), page);
        } else if (effective.initiativeId() != null) {
            executions = executionRepository.findByInitiativeIdOrderByStartedAtDesc(effective.initiativeId(), page);
        } else if (effective.status() != null) {
            executions = executionRepository.findByStatusOrderByStartedAtDesc(effective.status(), page);
        } else {
            executions = executionRepository.findAllByOrderByStartedAtDesc(page);
        }
        if (executions.isEmpty()) {
            return List.of();
        }

        List<UUID> ids = executions.stream().map(Execution::getId).toList();
        Map<EntityKind, CompletableFuture<Map<UUID, Long>>> pending = new EnumMap<>(EntityKind.class);
        for (EntityKind kind : EntityKind.values()) {
            pending.put(kind, withTimeout(Futures.supplyAsync(() -> entityStore.countByExecution(kind, ids), fetchExecutor)));
        }
        Map<EntityKind, Map<UUID, Long>> grouped = new EnumMap<>(EntityKind.class);
        pending.forEach((kind, future) -> grouped.put(kind, Futures.join(future)));

        List<ExecutionSummary> summaries = new ArrayList<>(executions.size());
        for (Execution execution : executions) {
            Map<EntityKind, Long> byKind = new EnumMap<>(EntityKind.class);
            grouped.forEach((kind, counts) -> byKind.put(kind, counts.getOrDefault(execution.getId(), 0L)));
            summaries.add(toSummary(execution, EntityCounts.from(byKind)));
        }
        log.debug("Projected {} summaries for filter={}", summaries.size(), effective);
        return summaries;
    }

    int clampLimit(Integer requested) {
        FlowtraceProperties.Summary config = properties.getSummary();
        int max = Math.max(1, config.getMaxPageSize());
        int limit = requested != null ? requested : config.getDefaultPageSize();
        return Math.min(Math.max(limit, 1), max);
    }

    private CompletableFuture<EntityCounts> countsFor(UUID executionId) {
        Map<EntityKind, CompletableFuture<Long>> pending = new EnumMap<>(EntityKind.class);
        for (EntityKind kind : EntityKind.values()) {
            pending.put(kind, withTimeout(Futures.supplyAsync(() -> entityStore.count(kind, executionId), fetchExecutor)));
        }
        return CompletableFuture.allOf(pending.values().toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    Map<EntityKind, Long> byKind = new EnumMap<>(EntityKind.class);
                    pending.forEach((kind, future) -> byKind.put(kind, future.join()));
                    return EntityCounts.from(byKind);
                });
    }

    private ExecutionSummary toSummary(Execution execution, EntityCounts counts) {
        return new ExecutionSummary(
                execution.getId(),
                execution.getInitiativeId(),
                execution.getWorkflowType(),
                execution.getStatus(),
                execution.getStartedAt(),
                execution.getCompletedAt(),
                durationSeconds(execution),
                counts.campaigns(),
                counts.adSets(),
                counts.posts(),
                counts.researchEntries(),
                counts.mediaFiles(),
                copy(execution.getStepsCompleted()),
                copy(execution.getStepsFailed()),
                copy(execution.getErrorMessages()),
                copy(execution.getGuardrailViolations()),
                execution.getMetadata() != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(execution.getMetadata()))
                        : Map.of());
    }

    // Running executions measure against now; a skewed clock never yields a negative duration
    private double durationSeconds(Execution execution) {
        if (execution.getStartedAt() == null) {
            return 0.0;
        }
        Instant end = execution.getCompletedAt() != null ? execution.getCompletedAt() : clock.instant();
        Duration elapsed = Duration.between(execution.getStartedAt(), end);
        return elapsed.isNegative() ? 0.0 : elapsed.toMillis() / 1000.0;
    }

    private <T> CompletableFuture<T> withTimeout(CompletableFuture<T> future) {
        return future.orTimeout(properties.getFetch().getTimeout().toMillis(), TimeUnit.MILLISECONDS);
    }

    private static <T> List<T> copy(List<T> source) {
        return source != null ? Collections.unmodifiableList(new ArrayList<>(source)) : List.of();
    }
}
