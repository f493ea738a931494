package com.flowtrace.flowtrace_backend.service;

import com.flowtrace.flowtrace_backend.config.FlowtraceProperties;
import com.flowtrace.flowtrace_backend.exception.PartialFetchException;
import com.flowtrace.flowtrace_backend.model.domain.AdSet;
import com.flowtrace.flowtrace_backend.model.domain.Campaign;
import com.flowtrace.flowtrace_backend.model.domain.EntityKind;
import com.flowtrace.flowtrace_backend.model.domain.MediaFile;
import com.flowtrace.flowtrace_backend.model.domain.Post;
import com.flowtrace.flowtrace_backend.model.domain.ResearchEntry;
import com.flowtrace.flowtrace_backend.model.trace.ExecutionSummary;
import com.flowtrace.flowtrace_backend.model.trace.ExecutionTrace;
import com.flowtrace.flowtrace_backend.model.trace.TraceWarning;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Assembles the full trace of one execution: its summary plus every entity tagged with it.
 * <p>
 * The summary and the five collections are fetched concurrently. A missing execution fails the whole call;
 * a failed collection comes back empty with a {@link TraceWarning} so the rest of the trace still renders.
 */
@Slf4j
@Service
public class TraceAssembler {

    private final SummaryProjector    summaryProjector;
    private final EntityStore         entityStore;
    private final Executor            fetchExecutor;
    private final FlowtraceProperties properties;

    public TraceAssembler(SummaryProjector summaryProjector,
                          EntityStore entityStore,
                          @Qualifier("traceFetchExecutor") Executor fetchExecutor,
                          FlowtraceProperties properties) {
        this.summaryProjector = summaryProjector;
        this.entityStore = entityStore;
        this.fetchExecutor = fetchExecutor;
        this.properties = properties;
    }

    public ExecutionTrace assemble(UUID executionId) {
        CompletableFuture<ExecutionSummary> summary = summaryProjector.projectAsync(executionId);

        Map<EntityKind, PartialFetchException> failures = Collections.synchronizedMap(new EnumMap<>(EntityKind.class));
        CompletableFuture<List<Campaign>>      campaigns = fetch(EntityKind.CAMPAIGN, () -> entityStore.campaigns(executionId), failures);
        CompletableFuture<List<AdSet>>         adSets    = fetch(EntityKind.AD_SET, () -> entityStore.adSets(executionId), failures);
        CompletableFuture<List<Post>>          posts     = fetch(EntityKind.POST, () -> entityStore.posts(executionId), failures);
        CompletableFuture<List<ResearchEntry>> research  = fetch(EntityKind.RESEARCH_ENTRY, () -> entityStore.research(executionId), failures);
        CompletableFuture<List<MediaFile>>     media     = fetch(EntityKind.MEDIA_FILE, () -> entityStore.mediaFiles(executionId), failures);

        // Wait for everything before surfacing a summary failure so no fetch outlives the call
        CompletableFuture.allOf(summary, campaigns, adSets, posts, research, media)
                .handle((ignored, error) -> null)
                .join();

        ExecutionSummary resolved = Futures.join(summary);

        List<TraceWarning> warnings = new ArrayList<>();
        for (EntityKind kind : EntityKind.values()) {
            PartialFetchException failure = failures.get(kind);
            if (failure != null) {
                warnings.add(failure.toWarning());
            }
        }

        ExecutionTrace trace = new ExecutionTrace(
                resolved,
                List.copyOf(campaigns.join()),
                List.copyOf(adSets.join()),
                List.copyOf(posts.join()),
                List.copyOf(research.join()),
                List.copyOf(media.join()),
                List.copyOf(warnings));

        log.debug("Assembled trace executionId={} status={} entities={} warnings={}",
                executionId, resolved.status(), trace.entityIds().size(), warnings.size());
        return trace;
    }

    private <T> CompletableFuture<List<T>> fetch(EntityKind kind,
                                                 Supplier<List<T>> loader,
                                                 Map<EntityKind, PartialFetchException> failures) {
        return Futures.supplyAsync(loader, fetchExecutor)
                .orTimeout(properties.getFetch().getTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .handle((rows, error) -> {
                    if (error == null) {
                        return rows != null ? rows : List.<T>of();
                    }
                    PartialFetchException failure = new PartialFetchException(kind, Futures.unwrap(error));
                    log.warn("Partial trace: {}", failure.getMessage());
                    failures.put(kind, failure);
                    return List.<T>of();
                });
    }
}
