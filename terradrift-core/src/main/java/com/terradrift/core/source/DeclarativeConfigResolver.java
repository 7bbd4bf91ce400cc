package com.terradrift.core.source;

import com.terradrift.core.error.DefinitionParseException;
import com.terradrift.core.error.ResourceNotFoundException;
import com.terradrift.core.model.ConfigValue;

/**
 * Resolves the declared configuration of one resource from infrastructure definitions.
 *
 * <p>Implementations must be safe to call from several worker threads at once.
 */
public interface DeclarativeConfigResolver {

    /**
     * Resolves the declared configuration tree of a resource.
     *
     * @param resourceId resource identifier
     * @return normalized configuration tree (a map)
     * @throws ResourceNotFoundException if no definition matches the identifier
     * @throws DefinitionParseException if the source cannot be read or parsed
     */
    ConfigValue resolve(String resourceId);

    /**
     * Short description of the source for logs and error messages.
     *
     * @return source description, e.g. the file path
     */
    String describe();
}
