package com.terradrift.core.orchestration;

import com.terradrift.core.model.DriftReport;
import com.terradrift.core.orchestration.ResourceOutcome.Status;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcomes of one run, in the order the identifiers were submitted.
 *
 * @param outcomes one outcome per distinct identifier
 */
public record RunSummary(List<ResourceOutcome> outcomes) {

    /**
     * Compact constructor with validation.
     */
    public RunSummary {
        Objects.requireNonNull(outcomes, "outcomes must not be null");
        outcomes = List.copyOf(outcomes);
    }

    /**
     * Looks up the outcome of one identifier.
     *
     * @param resourceId resource identifier
     * @return outcome, or empty if the identifier was not part of the run
     */
    public Optional<ResourceOutcome> get(String resourceId) {
        return outcomes.stream().filter(o -> o.resourceId().equals(resourceId)).findFirst();
    }

    public List<DriftReport> reports() {
        return outcomes.stream().flatMap(o -> o.getReport().stream()).toList();
    }

    public long count(Status status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }

    public boolean hasFailures() {
        return count(Status.FAILED) > 0;
    }

    public boolean wasCancelled() {
        return count(Status.CANCELLED) > 0;
    }

    /**
     * Returns true if every resource was compared, none failed and none was cancelled.
     *
     * @return true for a fully successful run
     */
    public boolean isSuccessful() {
        return outcomes.stream().allMatch(o -> o.status() == Status.COMPLETED);
    }

    public boolean hasDrift() {
        return outcomes.stream().anyMatch(ResourceOutcome::hasDrift);
    }

    /**
     * Total drifted attributes across all completed resources.
     *
     * @return drift record count
     */
    public int totalDriftCount() {
        return reports().stream().mapToInt(DriftReport::driftCount).sum();
    }
}
