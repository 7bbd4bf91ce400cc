package com.terradrift.core.source.terraform;

import com.terradrift.core.model.AttributePath;

import java.util.Objects;

/**
 * How a resource identifier is matched against Terraform sources.
 *
 * @param resourceType Terraform resource type to consider, e.g. {@code aws_instance}
 * @param stateIdentifierField attribute of a state entry that holds the identifier
 * @param definitionMatchAttribute dotted attribute of a {@code resource} block compared with
 *                                 the identifier, e.g. {@code tags.Name}
 */
public record TerraformLookup(
    String resourceType,
    String stateIdentifierField,
    AttributePath definitionMatchAttribute
) {
    public static final String DEFAULT_RESOURCE_TYPE = "aws_instance";
    public static final String DEFAULT_STATE_IDENTIFIER_FIELD = "id";
    public static final String DEFAULT_DEFINITION_MATCH_ATTRIBUTE = "tags.Name";

    /**
     * Compact constructor with validation.
     */
    public TerraformLookup {
        Objects.requireNonNull(resourceType, "resourceType must not be null");
        Objects.requireNonNull(stateIdentifierField, "stateIdentifierField must not be null");
        Objects.requireNonNull(definitionMatchAttribute, "definitionMatchAttribute must not be null");
        if (resourceType.isBlank()) {
            throw new IllegalArgumentException("resourceType must not be blank");
        }
    }

    public static TerraformLookup defaults() {
        return new TerraformLookup(
            DEFAULT_RESOURCE_TYPE,
            DEFAULT_STATE_IDENTIFIER_FIELD,
            AttributePath.parse(DEFAULT_DEFINITION_MATCH_ATTRIBUTE)
        );
    }

    /**
     * Builds a lookup, substituting the default for every null or blank argument.
     *
     * @param resourceType resource type, may be null
     * @param stateIdentifierField state identifier field, may be null
     * @param definitionMatchAttribute dotted match attribute, may be null
     * @return lookup settings
     */
    public static TerraformLookup of(String resourceType, String stateIdentifierField, String definitionMatchAttribute) {
        return new TerraformLookup(
            orDefault(resourceType, DEFAULT_RESOURCE_TYPE),
            orDefault(stateIdentifierField, DEFAULT_STATE_IDENTIFIER_FIELD),
            AttributePath.parse(orDefault(definitionMatchAttribute, DEFAULT_DEFINITION_MATCH_ATTRIBUTE))
        );
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
