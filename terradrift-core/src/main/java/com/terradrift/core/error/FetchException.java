package com.terradrift.core.error;

/**
 * The live resource could not be fetched.
 */
public class FetchException extends DriftException {

    private final String resourceId;

    public FetchException(String resourceId, String message) {
        super(ErrorKind.FETCH, message);
        this.resourceId = resourceId;
    }

    public FetchException(String resourceId, String message, Throwable cause) {
        super(ErrorKind.FETCH, message, cause);
        this.resourceId = resourceId;
    }

    public String getResourceId() {
        return resourceId;
    }
}
