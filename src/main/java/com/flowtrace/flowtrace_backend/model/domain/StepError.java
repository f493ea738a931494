package com.flowtrace.flowtrace_backend.model.domain;

import java.time.Instant;

public record StepError(String step, String message, Instant timestamp) {}
