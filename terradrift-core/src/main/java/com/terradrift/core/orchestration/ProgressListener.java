package com.terradrift.core.orchestration;

/**
 * Receives one callback per finished resource check.
 *
 * <p>Called from worker threads; implementations must be thread-safe.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (outcome, completed, total) -> { };

    /**
     * Called after a resource check ends.
     *
     * @param outcome the finished check
     * @param completed number of checks finished so far, including this one
     * @param total number of checks in the run
     */
    void onOutcome(ResourceOutcome outcome, int completed, int total);
}
