package com.flowtrace.flowtrace_backend.live;

import com.flowtrace.flowtrace_backend.engine.ExecutionChangedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Refreshes on ledger changes instead of on a timer. Only sees writes made through this process's ledger;
 * rows another process adds to the Entity Store show up on the next ledger change.
 * <p>
 * Attaching schedules one refresh straight away, which picks up any change committed between the caller's
 * baseline read and the attach.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "flowtrace.live.strategy", havingValue = "EVENTS")
public class EventDrivenRefreshStrategy implements TraceRefreshStrategy {

    private final TaskScheduler scheduler;
    private final Map<UUID, Set<Runnable>> watchers = new ConcurrentHashMap<>();

    public EventDrivenRefreshStrategy(@Qualifier("liveViewScheduler") TaskScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public RefreshHandle attach(UUID executionId, Runnable refresh) {
        watchers.computeIfAbsent(executionId, id -> ConcurrentHashMap.newKeySet()).add(refresh);
        scheduler.schedule(refresh, Instant.now());
        return () -> watchers.computeIfPresent(executionId, (id, refreshes) -> {
            refreshes.remove(refresh);
            return refreshes.isEmpty() ? null : refreshes;
        });
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onExecutionChanged(ExecutionChangedEvent event) {
        Set<Runnable> refreshes = watchers.get(event.executionId());
        if (refreshes == null) {
            return;
        }
        log.debug("Ledger change {} for executionId={}, refreshing {} watch(es)",
                event.change(), event.executionId(), refreshes.size());
        for (Runnable refresh : refreshes) {
            scheduler.schedule(refresh, Instant.now());
        }
    }
}
