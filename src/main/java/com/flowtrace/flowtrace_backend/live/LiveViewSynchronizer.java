package com.flowtrace.flowtrace_backend.live;

import com.flowtrace.flowtrace_backend.config.FlowtraceProperties;
import com.flowtrace.flowtrace_backend.exception.NotFoundException;
import com.flowtrace.flowtrace_backend.exception.ValidationException;
import com.flowtrace.flowtrace_backend.model.trace.ExecutionTrace;
import com.flowtrace.flowtrace_backend.service.TraceAssembler;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps live views of running executions up to date.
 * <p>
 * Each watch re-assembles its trace whenever the refresh strategy fires and calls the listener only when
 * something visible changed. Once the execution is terminal the listener gets the final trace exactly once and
 * the watch ends by itself. Refreshes for one watch never overlap: a trigger that arrives mid-refresh is folded
 * into one more pass.
 */
@Slf4j
@Service
public class LiveViewSynchronizer {

    private final TraceAssembler       assembler;
    private final TraceRefreshStrategy refreshStrategy;
    private final int                  maxConsecutiveFailures;

    private final Map<UUID, LiveSubscription> subscriptions = new ConcurrentHashMap<>();

    public LiveViewSynchronizer(TraceAssembler assembler,
                                TraceRefreshStrategy refreshStrategy,
                                FlowtraceProperties properties) {
        this.assembler = assembler;
        this.refreshStrategy = refreshStrategy;
        this.maxConsecutiveFailures = Math.max(1, properties.getLive().getMaxConsecutiveFailures());
    }

    /**
     * Starts watching an execution. The returned subscription carries the trace as of now; the listener is
     * not called for it. For an execution that is already terminal the listener receives that trace once and
     * the subscription comes back inactive.
     *
     * @throws NotFoundException when the execution does not exist
     */
    public TraceSubscription watch(UUID executionId, TraceListener listener) {
        if (executionId == null) {
            throw new ValidationException("executionId is required");
        }
        if (listener == null) {
            throw new ValidationException("listener is required");
        }
        ExecutionTrace baseline = assembler.assemble(executionId);
        LiveSubscription subscription = new LiveSubscription(executionId, listener, baseline);

        if (baseline.summary().status().isTerminal()) {
            log.debug("Execution {} already {}, delivering final trace", executionId, baseline.summary().status());
            subscription.finish(baseline);
            return subscription;
        }

        subscriptions.put(subscription.getId(), subscription);
        subscription.attach(refreshStrategy.attach(executionId, subscription::requestRefresh));
        log.info("Watching executionId={} subscriptionId={}", executionId, subscription.getId());
        return subscription;
    }

    /** Returns false when the subscription is unknown or already ended. */
    public boolean unwatch(UUID subscriptionId) {
        LiveSubscription subscription = subscriptions.get(subscriptionId);
        if (subscription == null) {
            return false;
        }
        subscription.unwatch();
        return true;
    }

    public int activeCount() {
        return subscriptions.size();
    }

    @PreDestroy
    public void shutdown() {
        new ArrayList<>(subscriptions.values()).forEach(LiveSubscription::unwatch);
    }

    private final class LiveSubscription implements TraceSubscription {

        private final UUID           id = UUID.randomUUID();
        private final UUID           executionId;
        private final TraceListener  listener;
        private final ExecutionTrace initialTrace;

        private final AtomicBoolean active = new AtomicBoolean(true);
        private final AtomicInteger wip    = new AtomicInteger();
        private final Object        deliveryLock = new Object();

        private volatile RefreshHandle    handle;
        private volatile TraceFingerprint lastSeen;
        private volatile int              consecutiveFailures;
        private boolean                   unwatched;

        LiveSubscription(UUID executionId, TraceListener listener, ExecutionTrace initialTrace) {
            this.executionId = executionId;
            this.listener = listener;
            this.initialTrace = initialTrace;
            this.lastSeen = TraceFingerprint.of(initialTrace);
        }

        @Override
        public UUID getId() {
            return id;
        }

        @Override
        public UUID getExecutionId() {
            return executionId;
        }

        @Override
        public ExecutionTrace getInitialTrace() {
            return initialTrace;
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        @Override
        public void unwatch() {
            synchronized (deliveryLock) {
                unwatched = true;
            }
            if (active.compareAndSet(true, false)) {
                release();
                log.info("Unwatched executionId={} subscriptionId={}", executionId, id);
            }
        }

        void attach(RefreshHandle refreshHandle) {
            this.handle = refreshHandle;
            if (!active.get()) {
                refreshHandle.cancel();
            }
        }

        void requestRefresh() {
            if (!active.get() || wip.getAndIncrement() != 0) {
                return;
            }
            int missed = 1;
            do {
                refreshOnce();
                missed = wip.addAndGet(-missed);
            } while (missed != 0);
        }

        private void refreshOnce() {
            if (!active.get()) {
                return;
            }
            ExecutionTrace trace;
            try {
                trace = assembler.assemble(executionId);
                consecutiveFailures = 0;
            } catch (NotFoundException e) {
                fail(e);
                return;
            } catch (RuntimeException e) {
                int failures = ++consecutiveFailures;
                log.warn("Refresh failed for executionId={} ({}/{}): {}",
                        executionId, failures, maxConsecutiveFailures, e.getMessage());
                if (failures >= maxConsecutiveFailures) {
                    fail(e);
                }
                return;
            }

            if (trace.summary().status().isTerminal()) {
                finish(trace);
                return;
            }
            TraceFingerprint fingerprint = TraceFingerprint.of(trace);
            if (!fingerprint.equals(lastSeen)) {
                lastSeen = fingerprint;
                deliver(trace);
            }
        }

        void finish(ExecutionTrace finalTrace) {
            if (active.compareAndSet(true, false)) {
                release();
                log.info("Execution {} reached {}, closing subscriptionId={}",
                        executionId, finalTrace.summary().status().wireName(), id);
                deliver(finalTrace);
            }
        }

        private void fail(RuntimeException error) {
            if (!active.compareAndSet(true, false)) {
                return;
            }
            release();
            log.error("Live view for executionId={} stopped: {}", executionId, error.getMessage());
            synchronized (deliveryLock) {
                if (unwatched) {
                    return;
                }
                try {
                    listener.onError(error);
                } catch (RuntimeException e) {
                    log.error("Listener error callback threw for subscriptionId={}", id, e);
                }
            }
        }

        private void deliver(ExecutionTrace trace) {
            synchronized (deliveryLock) {
                if (unwatched) {
                    return;
                }
                try {
                    listener.onChange(trace);
                } catch (RuntimeException e) {
                    log.error("Listener threw for subscriptionId={}", id, e);
                }
            }
        }

        private void release() {
            subscriptions.remove(id, this);
            RefreshHandle current = handle;
            if (current != null) {
                current.cancel();
            }
        }
    }
}
