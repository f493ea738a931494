package com.flowtrace.flowtrace_backend.model.domain;

import java.time.Instant;

/** A policy check that tripped during a step. Informational; it never changes execution status. */
public record GuardrailViolation(String step, String message, Instant timestamp) {}
