package com.flowtrace.flowtrace_backend.exception;

import java.util.UUID;

public class NotFoundException extends TraceException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException execution(UUID executionId) {
        return new NotFoundException("Execution not found: " + executionId);
    }

    @Override
    protected String getDefaultErrorCode() {
        return "ERR-NF-001";
    }
}
