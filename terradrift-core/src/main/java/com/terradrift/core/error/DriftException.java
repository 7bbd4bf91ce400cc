package com.terradrift.core.error;

/**
 * Base exception for all drift detection failures.
 *
 * <p>The comparison engine itself never throws: a missing attribute is data, not an error.
 * These exceptions come from the collaborators around it (fetcher, resolver, startup checks).
 */
public abstract class DriftException extends RuntimeException {

    private final ErrorKind kind;

    protected DriftException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected DriftException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isFatal() {
        return kind.isFatal();
    }
}
