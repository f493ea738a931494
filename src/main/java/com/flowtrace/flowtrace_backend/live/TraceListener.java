package com.flowtrace.flowtrace_backend.live;

import com.flowtrace.flowtrace_backend.model.trace.ExecutionTrace;

/** Receives refreshed traces for one watched execution. Calls for one subscription never overlap. */
@FunctionalInterface
public interface TraceListener {

    void onChange(ExecutionTrace trace);

    /** The subscription was torn down because the trace could no longer be refreshed. */
    default void onError(Throwable error) {
    }
}
