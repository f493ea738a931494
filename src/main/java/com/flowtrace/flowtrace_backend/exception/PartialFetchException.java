package com.flowtrace.flowtrace_backend.exception;

import com.flowtrace.flowtrace_backend.model.domain.EntityKind;
import com.flowtrace.flowtrace_backend.model.trace.TraceWarning;
import lombok.Getter;

/**
 * One entity collection could not be loaded during trace assembly. Never thrown out of the assembler;
 * it is turned into a {@link TraceWarning} on the returned trace.
 */
@Getter
public class PartialFetchException extends TraceException {

    private final EntityKind kind;

    public PartialFetchException(EntityKind kind, Throwable cause) {
        super(kind.getSection() + " unavailable: " + describe(cause), cause);
        this.kind = kind;
    }

    public TraceWarning toWarning() {
        return new TraceWarning(getErrorCode(), kind, kind.getSection(), getMessage());
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    @Override
    protected String getDefaultErrorCode() {
        return "ERR-FETCH-001";
    }
}
