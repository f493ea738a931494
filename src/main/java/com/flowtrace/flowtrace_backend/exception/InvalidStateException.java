package com.flowtrace.flowtrace_backend.exception;

/** An upstream caller tried to move an execution somewhere its current state does not allow. */
public class InvalidStateException extends TraceException {

    public InvalidStateException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return "ERR-STATE-001";
    }
}
