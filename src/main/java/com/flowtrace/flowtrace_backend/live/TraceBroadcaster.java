package com.flowtrace.flowtrace_backend.live;

import com.flowtrace.flowtrace_backend.engine.ExecutionEventPublisher;
import com.flowtrace.flowtrace_backend.model.trace.ExecutionTrace;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pushes live traces to STOMP subscribers of {@code /topic/execution/{id}/trace}.
 * Keeps at most one watch per execution however many inspectors are looking at it; each {@link #start} is
 * balanced by one {@link #stop} and the watch ends when the last inspector stops.
 */
@Slf4j
@Component
public class TraceBroadcaster {

    private final LiveViewSynchronizer    synchronizer;
    private final ExecutionEventPublisher publisher;

    private final Map<UUID, Broadcast> broadcasts = new ConcurrentHashMap<>();

    public TraceBroadcaster(LiveViewSynchronizer synchronizer, ExecutionEventPublisher publisher) {
        this.synchronizer = synchronizer;
        this.publisher = publisher;
    }

    /** Starts broadcasting, or joins the running broadcast for this execution. */
    public synchronized TraceSubscription start(UUID executionId) {
        Broadcast existing = broadcasts.get(executionId);
        if (existing != null && existing.subscription.isActive()) {
            existing.inspectors++;
            log.debug("Joined live trace for executionId={}, inspectors={}", executionId, existing.inspectors);
            return existing.subscription;
        }
        TraceSubscription subscription = synchronizer.watch(executionId, new TraceListener() {
            @Override
            public void onChange(ExecutionTrace trace) {
                publisher.traceUpdated(executionId, trace);
                if (trace.summary().status().isTerminal()) {
                    broadcasts.remove(executionId);
                }
            }

            @Override
            public void onError(Throwable error) {
                publisher.traceFailed(executionId, error);
                broadcasts.remove(executionId);
            }
        });
        if (subscription.isActive()) {
            broadcasts.put(executionId, new Broadcast(subscription));
            log.info("Broadcasting live trace for executionId={}", executionId);
        }
        return subscription;
    }

    /**
     * Leaves the broadcast for this execution. The watch itself ends only once every inspector that started
     * it has left. Returns false when nothing is being broadcast.
     */
    public synchronized boolean stop(UUID executionId) {
        Broadcast broadcast = broadcasts.get(executionId);
        if (broadcast == null) {
            return false;
        }
        if (--broadcast.inspectors > 0) {
            log.debug("Left live trace for executionId={}, inspectors={}", executionId, broadcast.inspectors);
            return true;
        }
        broadcasts.remove(executionId, broadcast);
        broadcast.subscription.unwatch();
        log.info("Stopped live trace for executionId={}", executionId);
        return true;
    }

    synchronized int inspectorCount(UUID executionId) {
        Broadcast broadcast = broadcasts.get(executionId);
        return broadcast != null ? broadcast.inspectors : 0;
    }

    // Guarded by the broadcaster's monitor
    private static final class Broadcast {

        private final TraceSubscription subscription;
        private int inspectors = 1;

        Broadcast(TraceSubscription subscription) {
            this.subscription = subscription;
        }
    }
}
