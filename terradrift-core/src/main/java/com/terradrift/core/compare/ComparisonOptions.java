package com.terradrift.core.compare;

import com.terradrift.core.model.AttributePath;

import java.util.List;
import java.util.Objects;

/**
 * Per-call comparison settings: which attributes to inspect and how to match lists.
 *
 * <p>Passed explicitly to {@link DriftClassifier#classify}; there is no process-wide
 * checklist.
 *
 * @param attributes attribute checklist, in report order
 * @param matching list matching strategy
 */
public record ComparisonOptions(
    List<AttributePath> attributes,
    MatchingStrategy matching
) {
    /**
     * Well-known EC2 instance attributes checked when the caller does not supply a checklist.
     */
    public static final List<String> DEFAULT_ATTRIBUTES = List.of(
        "instance_type",
        "ami",
        "subnet_id",
        "vpc_security_group_ids",
        "associate_public_ip_address",
        "tags",
        "root_block_device",
        "ebs_block_device"
    );

    /**
     * Compact constructor with validation.
     */
    public ComparisonOptions {
        Objects.requireNonNull(attributes, "attributes must not be null");
        attributes = List.copyOf(attributes);
        if (matching == null) {
            matching = MatchingStrategy.BIPARTITE;
        }
    }

    /**
     * Default checklist with bipartite list matching.
     *
     * @return default options
     */
    public static ComparisonOptions defaults() {
        return of(DEFAULT_ATTRIBUTES);
    }

    /**
     * Options for the given dotted attribute names with bipartite list matching.
     *
     * @param attributes dotted attribute paths
     * @return options
     */
    public static ComparisonOptions of(List<String> attributes) {
        return new ComparisonOptions(AttributePath.parseAll(attributes), MatchingStrategy.BIPARTITE);
    }

    /**
     * Returns a copy with a different matching strategy.
     *
     * @param strategy list matching strategy
     * @return new options
     */
    public ComparisonOptions withMatching(MatchingStrategy strategy) {
        return new ComparisonOptions(attributes, strategy);
    }
}
