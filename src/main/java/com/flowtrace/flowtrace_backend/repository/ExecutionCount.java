package com.flowtrace.flowtrace_backend.repository;

import java.util.UUID;

/** Row of a grouped count by execution id. */
public interface ExecutionCount {

    UUID getExecutionId();

    long getTotal();
}
