package com.flowtrace.flowtrace_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum StepOutcome {
    COMPLETED,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static StepOutcome fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Step outcome is required");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "completed", "success", "succeeded" -> COMPLETED;
            case "failed", "failure" -> FAILED;
            default -> throw new IllegalArgumentException("Unknown step outcome: " + value);
        };
    }
}
