package com.terradrift.core.model;

/**
 * Classification of a single drift record.
 */
public enum DriftStatus {
    /** Present on both sides with different values */
    VALUE_MISMATCH("Values differ between live resource and declared configuration"),
    /** Present on the live resource only */
    ONLY_IN_LIVE("Exists on live resource but not in declared configuration"),
    /** Present in the declared configuration only */
    ONLY_IN_DECLARED("Exists in declared configuration but not on live resource");

    private final String description;

    DriftStatus(String description) {
        this.description = description;
    }

    /**
     * Human-readable description used by the text renderer.
     *
     * @return description
     */
    public String getDescription() {
        return description;
    }
}
