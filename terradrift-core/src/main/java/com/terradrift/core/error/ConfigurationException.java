package com.terradrift.core.error;

/**
 * The caller supplied an invalid combination of inputs.
 */
public class ConfigurationException extends DriftException {

    public ConfigurationException(String message) {
        super(ErrorKind.CONFIGURATION, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorKind.CONFIGURATION, message, cause);
    }
}
