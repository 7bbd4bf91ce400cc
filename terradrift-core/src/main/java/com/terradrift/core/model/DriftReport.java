package com.terradrift.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Drift findings for one resource.
 *
 * <p>Records are keyed by attribute expression and keep checklist order, so rendering a
 * report is deterministic. Immutable once built.
 *
 * @param resourceId identifier of the checked resource
 * @param generatedAt time the comparison was made
 * @param records drift records keyed by attribute expression
 */
public record DriftReport(
    String resourceId,
    Instant generatedAt,
    Map<String, DriftRecord> records
) {
    /**
     * Compact constructor with validation.
     */
    public DriftReport {
        Objects.requireNonNull(resourceId, "resourceId must not be null");
        Objects.requireNonNull(generatedAt, "generatedAt must not be null");
        Objects.requireNonNull(records, "records must not be null");
        records = Collections.unmodifiableMap(new LinkedHashMap<>(records));
    }

    /**
     * Returns true if at least one attribute drifted.
     *
     * @return true if drift was found
     */
    public boolean hasDrift() {
        return !records.isEmpty();
    }

    public int driftCount() {
        return records.size();
    }
}
