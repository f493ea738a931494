package com.flowtrace.flowtrace_backend.live;

import com.flowtrace.flowtrace_backend.model.trace.ExecutionTrace;

import java.util.UUID;

public interface TraceSubscription {

    UUID getId();

    UUID getExecutionId();

    /** Trace assembled when the watch began. */
    ExecutionTrace getInitialTrace();

    boolean isActive();

    /** Stops delivery. Safe to call more than once; no callback starts after it returns. */
    void unwatch();
}
