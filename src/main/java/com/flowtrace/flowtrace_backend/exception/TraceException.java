package com.flowtrace.flowtrace_backend.exception;

import lombok.Getter;

/**
 * Base of every error the trace engine raises on purpose. Carries a stable code the inspector can key banners on.
 */
@Getter
public abstract class TraceException extends RuntimeException {

    private final String errorCode;

    protected TraceException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected TraceException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    protected abstract String getDefaultErrorCode();
}
