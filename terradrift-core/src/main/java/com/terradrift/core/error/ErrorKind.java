package com.terradrift.core.error;

/**
 * Error taxonomy for drift checks.
 */
public enum ErrorKind {
    /** Live source unreachable, or resource absent after retries */
    FETCH("Failed to fetch live resource", false),
    /** Declarative source is malformed */
    PARSE("Failed to parse declarative source", false),
    /** Resource identifier absent from the declarative source */
    NOT_FOUND("Resource not found in declarative source", false),
    /** Invalid invocation, detected before any worker runs */
    CONFIGURATION("Invalid configuration", true);

    private final String defaultMessage;
    private final boolean fatal;

    ErrorKind(String defaultMessage, boolean fatal) {
        this.defaultMessage = defaultMessage;
        this.fatal = fatal;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    /**
     * Returns true if this kind aborts the whole run rather than a single resource check.
     *
     * @return true for run-level errors
     */
    public boolean isFatal() {
        return fatal;
    }
}
