package com.terradrift.core.error;

/**
 * The resource identifier does not appear in the declarative source.
 */
public class ResourceNotFoundException extends DriftException {

    public ResourceNotFoundException(String resourceType, String resourceId, String sourceDescription) {
        super(ErrorKind.NOT_FOUND,
            String.format("%s %s not found in %s", resourceType, resourceId, sourceDescription));
    }
}
