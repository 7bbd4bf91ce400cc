package com.terradrift.core.orchestration;

import com.terradrift.core.model.DriftReport;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of checking one resource.
 *
 * @param resourceId checked resource identifier
 * @param status how the check ended
 * @param report drift report, set only when {@link Status#COMPLETED}
 * @param error failure cause, set only when {@link Status#FAILED}
 */
public record ResourceOutcome(
    String resourceId,
    Status status,
    DriftReport report,
    Throwable error
) {
    /**
     * How a resource check ended.
     */
    public enum Status {
        /** Compared successfully; the report may or may not contain drift */
        COMPLETED,
        /** Fetching, resolving or comparing raised an error */
        FAILED,
        /** The run was cancelled before or while the check ran */
        CANCELLED
    }

    /**
     * Compact constructor with validation.
     */
    public ResourceOutcome {
        Objects.requireNonNull(resourceId, "resourceId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        if ((status == Status.COMPLETED) != (report != null)) {
            throw new IllegalArgumentException("report must be set exactly when status is COMPLETED");
        }
        if ((status == Status.FAILED) != (error != null)) {
            throw new IllegalArgumentException("error must be set exactly when status is FAILED");
        }
    }

    public static ResourceOutcome completed(DriftReport report) {
        return new ResourceOutcome(report.resourceId(), Status.COMPLETED, report, null);
    }

    public static ResourceOutcome failed(String resourceId, Throwable error) {
        return new ResourceOutcome(resourceId, Status.FAILED, null, error);
    }

    public static ResourceOutcome cancelled(String resourceId) {
        return new ResourceOutcome(resourceId, Status.CANCELLED, null, null);
    }

    public Optional<DriftReport> getReport() {
        return Optional.ofNullable(report);
    }

    public boolean hasDrift() {
        return report != null && report.hasDrift();
    }
}
