package com.flowtrace.flowtrace_backend.live;

import java.util.UUID;

/**
 * Decides when a watched execution is re-assembled. Polling ticks on a fixed interval; the event-driven
 * variant reacts to ledger changes committed in this process.
 */
public interface TraceRefreshStrategy {

    RefreshHandle attach(UUID executionId, Runnable refresh);
}
