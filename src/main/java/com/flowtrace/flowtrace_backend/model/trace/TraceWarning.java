package com.flowtrace.flowtrace_backend.model.trace;

import com.flowtrace.flowtrace_backend.model.domain.EntityKind;

/**
 * Non-fatal problem found while assembling a trace: the named collection came back empty because its fetch failed.
 * The inspector shows it as a banner on that section only.
 */
public record TraceWarning(String code, EntityKind kind, String section, String message) {}
