package com.terradrift.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Dot-separated sequence of map keys identifying one comparable attribute.
 *
 * <p>{@code "tags.Name"} has segments {@code [tags, Name]}. A path parsed from an empty
 * string, or containing an empty segment (for example {@code "tags..Name"}), is kept
 * as written but marked unresolvable: it never matches anything.
 *
 * @param expression the original dotted text, used as the attribute name in reports
 * @param segments the map keys to walk, in order
 */
public record AttributePath(String expression, List<String> segments) {

    /**
     * Compact constructor with validation.
     */
    public AttributePath {
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(segments, "segments must not be null");
        segments = List.copyOf(segments);
    }

    /**
     * Parses a dotted path.
     *
     * @param expression dotted attribute path
     * @return parsed path
     */
    public static AttributePath parse(String expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        if (expression.isEmpty()) {
            return new AttributePath(expression, List.of());
        }
        return new AttributePath(expression, List.of(expression.split("\\.", -1)));
    }

    /**
     * Parses each expression in order.
     *
     * @param expressions dotted attribute paths
     * @return parsed paths
     */
    public static List<AttributePath> parseAll(List<String> expressions) {
        return expressions.stream().map(AttributePath::parse).toList();
    }

    /**
     * Returns true if the path has at least one segment and no empty segments.
     *
     * @return true if the path can resolve against a tree
     */
    public boolean isResolvable() {
        return !segments.isEmpty() && segments.stream().noneMatch(String::isEmpty);
    }

    @Override
    public String toString() {
        return expression;
    }
}
