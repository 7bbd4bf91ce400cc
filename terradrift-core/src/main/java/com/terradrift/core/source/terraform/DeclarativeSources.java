package com.terradrift.core.source.terraform;

import com.terradrift.core.error.ConfigurationException;
import com.terradrift.core.source.DeclarativeConfigResolver;

import java.nio.file.Path;

/**
 * Picks the declarative source implementation from the paths the user supplied.
 */
public final class DeclarativeSources {

    private DeclarativeSources() {
        // Utility class
    }

    /**
     * Creates a resolver for exactly one of a state file or a definition path.
     *
     * @param statePath Terraform state file, may be null
     * @param definitionPath {@code .tf} file or directory, may be null
     * @param lookup matching settings
     * @return resolver for the given source
     * @throws ConfigurationException if neither or both paths are given
     */
    public static DeclarativeConfigResolver of(Path statePath, Path definitionPath, TerraformLookup lookup) {
        if (statePath != null && definitionPath != null) {
            throw new ConfigurationException("Specify either a state file or a Terraform configuration, not both");
        }
        if (statePath != null) {
            return new StateFileResolver(statePath, lookup);
        }
        if (definitionPath != null) {
            return new HclDefinitionResolver(definitionPath, lookup);
        }
        throw new ConfigurationException("Either a state file or a Terraform configuration must be specified");
    }
}
