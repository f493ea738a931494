package com.flowtrace.flowtrace_backend.controller;

import com.flowtrace.flowtrace_backend.live.TraceBroadcaster;
import com.flowtrace.flowtrace_backend.live.TraceSubscription;
import com.flowtrace.flowtrace_backend.model.domain.AdSet;
import com.flowtrace.flowtrace_backend.model.domain.Campaign;
import com.flowtrace.flowtrace_backend.model.domain.ExecutionStatus;
import com.flowtrace.flowtrace_backend.model.domain.MediaFile;
import com.flowtrace.flowtrace_backend.model.domain.Post;
import com.flowtrace.flowtrace_backend.model.domain.ResearchEntry;
import com.flowtrace.flowtrace_backend.model.trace.ExecutionFilter;
import com.flowtrace.flowtrace_backend.model.trace.ExecutionSummary;
import com.flowtrace.flowtrace_backend.model.trace.ExecutionTrace;
import com.flowtrace.flowtrace_backend.service.EntityStore;
import com.flowtrace.flowtrace_backend.service.ExecutionLedger;
import com.flowtrace.flowtrace_backend.service.SummaryProjector;
import com.flowtrace.flowtrace_backend.service.TraceAssembler;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/** Read side for the Execution Inspector. */
@RestController
@RequestMapping("/api/executions")
@RequiredArgsConstructor
public class ExecutionController {

    private final SummaryProjector summaryProjector;
    private final TraceAssembler   traceAssembler;
    private final ExecutionLedger  ledger;
    private final EntityStore      entityStore;
    private final TraceBroadcaster broadcaster;

    // GET /api/executions/summaries?initiativeId=&status=&limit=: newest first, one page
    @GetMapping("/summaries")
    public List<ExecutionSummary> listSummaries(
            @RequestParam(required = false) UUID initiativeId,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) Integer limit) {
        ExecutionStatus statusFilter = status != null && !status.isBlank() ? ExecutionStatus.fromWireName(status) : null;
        return summaryProjector.projectMany(new ExecutionFilter(initiativeId, statusFilter, limit));
    }

    // GET /api/executions/{id}: full trace; warnings list any section that failed to load
    @GetMapping("/{id}")
    public ExecutionTrace getTrace(@PathVariable UUID id) {
        return traceAssembler.assemble(id);
    }

    @GetMapping("/{id}/summary")
    public ExecutionSummary getSummary(@PathVariable UUID id) {
        return summaryProjector.project(id);
    }

    // Single sections for lazy-loading tabs
    @GetMapping("/{id}/campaigns")
    public List<Campaign> getCampaigns(@PathVariable UUID id) {
        ledger.get(id);
        return entityStore.campaigns(id);
    }

    @GetMapping("/{id}/ad-sets")
    public List<AdSet> getAdSets(@PathVariable UUID id) {
        ledger.get(id);
        return entityStore.adSets(id);
    }

    @GetMapping("/{id}/posts")
    public List<Post> getPosts(@PathVariable UUID id) {
        ledger.get(id);
        return entityStore.posts(id);
    }

    @GetMapping("/{id}/research")
    public List<ResearchEntry> getResearch(@PathVariable UUID id) {
        ledger.get(id);
        return entityStore.research(id);
    }

    @GetMapping("/{id}/media")
    public List<MediaFile> getMedia(@PathVariable UUID id) {
        ledger.get(id);
        return entityStore.mediaFiles(id);
    }

    /** POST /api/executions/{id}/watch: start pushing traces to /topic/execution/{id}/trace. */
    @PostMapping("/{id}/watch")
    public WatchResponse watch(@PathVariable UUID id) {
        TraceSubscription subscription = broadcaster.start(id);
        return new WatchResponse(
                subscription.getId(),
                subscription.getExecutionId(),
                subscription.isActive(),
                subscription.getInitialTrace());
    }

    // DELETE /api/executions/{id}/watch: leave the broadcast; it stops once every watcher has left
    @DeleteMapping("/{id}/watch")
    public ResponseEntity<Void> unwatch(@PathVariable UUID id) {
        return broadcaster.stop(id)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    public record WatchResponse(
            UUID           subscriptionId,
            UUID           executionId,
            boolean        active,
            ExecutionTrace trace
    ) {}
}
