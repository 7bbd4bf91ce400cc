package com.terradrift.core.source;

import com.terradrift.core.error.FetchException;
import com.terradrift.core.model.ConfigValue;

/**
 * Retrieves the current attributes of a live resource.
 *
 * <p>Implementations normalize at their boundary and return a {@link ConfigValue.MapValue}.
 * Implementations must be safe to call from several worker threads at once.
 */
public interface LiveResourceFetcher {

    /**
     * Fetches the live configuration tree of a resource.
     *
     * @param resourceId resource identifier, e.g. an EC2 instance ID
     * @return normalized configuration tree (a map)
     * @throws FetchException if the resource is unreachable or absent after retries
     */
    ConfigValue fetch(String resourceId);
}
