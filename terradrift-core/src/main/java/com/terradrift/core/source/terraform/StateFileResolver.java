package com.terradrift.core.source.terraform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.terradrift.core.error.DefinitionParseException;
import com.terradrift.core.error.ResourceNotFoundException;
import com.terradrift.core.model.ConfigValue;
import com.terradrift.core.normalize.ConfigNormalizer;
import com.terradrift.core.source.DeclarativeConfigResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Resolves declared configuration from a Terraform state file.
 *
 * <p>Two layouts are understood:
 * <ul>
 *   <li>the raw state file ({@code terraform.tfstate}): {@code resources[].instances[].attributes},
 *       module-scoped resources included</li>
 *   <li>the output of {@code terraform show -json}: {@code values.root_module.resources[].values},
 *       recursing into {@code child_modules}</li>
 * </ul>
 *
 * <p>Only managed resources of the configured type are considered; data sources are skipped.
 * The file is read and parsed once, on first use.
 */
public class StateFileResolver implements DeclarativeConfigResolver {

    private static final Logger log = LoggerFactory.getLogger(StateFileResolver.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private static final String DATA_MODE = "data";

    private final Path stateFile;
    private final TerraformLookup lookup;

    private List<JsonNode> candidates;

    public StateFileResolver(Path stateFile, TerraformLookup lookup) {
        this.stateFile = Objects.requireNonNull(stateFile, "stateFile must not be null");
        this.lookup = Objects.requireNonNull(lookup, "lookup must not be null");
    }

    @Override
    public ConfigValue resolve(String resourceId) {
        for (JsonNode attributes : candidates()) {
            JsonNode identifier = attributes.path(lookup.stateIdentifierField());
            if (identifier.isValueNode() && identifier.asText().equals(resourceId)) {
                log.debug("Resolved {} {} from {}", lookup.resourceType(), resourceId, stateFile);
                return ConfigNormalizer.fromJson(attributes);
            }
        }
        throw new ResourceNotFoundException(lookup.resourceType(), resourceId, describe());
    }

    @Override
    public String describe() {
        return "state file " + stateFile;
    }

    private synchronized List<JsonNode> candidates() {
        if (candidates == null) {
            candidates = List.copyOf(collectCandidates(readState()));
            log.debug("Found {} {} entries in {}", candidates.size(), lookup.resourceType(), stateFile);
        }
        return candidates;
    }

    private JsonNode readState() {
        if (!Files.isRegularFile(stateFile)) {
            throw new DefinitionParseException(stateFile, "State file not found: " + stateFile);
        }
        try {
            JsonNode root = JSON_MAPPER.readTree(stateFile.toFile());
            if (root == null || !root.isObject()) {
                throw new DefinitionParseException(stateFile, "State file is not a JSON object: " + stateFile);
            }
            return root;
        } catch (IOException e) {
            throw new DefinitionParseException(stateFile,
                "Failed to parse state file " + stateFile + ": " + e.getMessage(), e);
        }
    }

    private List<JsonNode> collectCandidates(JsonNode root) {
        List<JsonNode> found = new ArrayList<>();
        JsonNode rootModule = root.path("values").path("root_module");
        if (rootModule.isObject()) {
            collectFromModule(rootModule, found);
        } else if (root.path("resources").isArray()) {
            collectFromRawState(root.path("resources"), found);
        } else {
            log.warn("State file {} has neither resources nor values.root_module", stateFile);
        }
        return found;
    }

    private void collectFromRawState(JsonNode resources, List<JsonNode> found) {
        for (JsonNode resource : resources) {
            if (!isManagedOfType(resource)) {
                continue;
            }
            for (JsonNode instance : resource.path("instances")) {
                JsonNode attributes = instance.path("attributes");
                if (attributes.isObject()) {
                    found.add(attributes);
                }
            }
        }
    }

    private void collectFromModule(JsonNode module, List<JsonNode> found) {
        for (JsonNode resource : module.path("resources")) {
            if (!isManagedOfType(resource)) {
                continue;
            }
            JsonNode values = resource.path("values");
            if (values.isObject()) {
                found.add(values);
            }
        }
        for (JsonNode child : module.path("child_modules")) {
            collectFromModule(child, found);
        }
    }

    private boolean isManagedOfType(JsonNode resource) {
        return lookup.resourceType().equals(resource.path("type").asText())
            && !DATA_MODE.equals(resource.path("mode").asText());
    }
}
