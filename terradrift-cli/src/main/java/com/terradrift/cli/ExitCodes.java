package com.terradrift.cli;

/**
 * Process exit codes shared by all commands.
 */
public final class ExitCodes {

    /** Every resource was compared */
    public static final int OK = 0;
    /** At least one resource check failed or was cancelled */
    public static final int FAILED = 1;
    /** Invalid options or settings; nothing was checked */
    public static final int CONFIGURATION_ERROR = 2;
    /** Drift was found and {@code --fail-on-drift} was given */
    public static final int DRIFT_DETECTED = 3;

    private ExitCodes() {
        // Constants
    }
}
