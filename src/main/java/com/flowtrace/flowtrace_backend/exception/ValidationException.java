package com.flowtrace.flowtrace_backend.exception;

/** A write carried a missing or malformed identifier. */
public class ValidationException extends TraceException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return "ERR-VAL-001";
    }
}
