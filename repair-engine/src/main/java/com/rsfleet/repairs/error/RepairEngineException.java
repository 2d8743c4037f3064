package com.rsfleet.repairs.error;

/**
 * Base class for every failure the repair engine reports to its callers.
 *
 * Unchecked so that throwing it out of a @Transactional method rolls the
 * whole unit of work back. The {@link Kind} lets the HTTP layer and the
 * metrics pick a category without an instanceof ladder.
 */
public abstract class RepairEngineException extends RuntimeException {

    public enum Kind { VALIDATION, AUTHORIZATION, TRANSITION, CONCURRENCY, PERSISTENCE }

    private final Kind kind;

    protected RepairEngineException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected RepairEngineException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }

    /** True when resubmitting the same request may succeed. */
    public boolean isRetryable() { return false; }
}
