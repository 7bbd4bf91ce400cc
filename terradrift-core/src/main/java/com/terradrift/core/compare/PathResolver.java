package com.terradrift.core.compare;

import com.terradrift.core.model.AttributePath;
import com.terradrift.core.model.ConfigValue;
import com.terradrift.core.model.ConfigValue.MapValue;

import java.util.Optional;

/**
 * Resolves a dotted {@link AttributePath} against a configuration tree.
 *
 * <p>Resolution only descends through {@link MapValue} nodes. List indexing is not
 * supported: list-valued attributes are compared as a whole. Absence is a normal outcome
 * and is reported as {@link Optional#empty()}, never as an exception.
 *
 * <p><b>Examples</b> against {@code {tags: {Name: "x"}}}:
 * <ul>
 *   <li>{@code tags.Name} resolves to {@code "x"}</li>
 *   <li>{@code tags} resolves to the inner map</li>
 *   <li>{@code tags.Name.first} is absent (a string is not a map)</li>
 *   <li>{@code tags.Owner} is absent</li>
 * </ul>
 */
public final class PathResolver {

    private PathResolver() {
        // Utility class
    }

    /**
     * Resolves a path against a tree.
     *
     * @param tree root value; resolution fails unless it is a map
     * @param path attribute path
     * @return resolved value, or empty if any segment is missing or a non-map is reached
     *         while segments remain
     */
    public static Optional<ConfigValue> resolve(ConfigValue tree, AttributePath path) {
        if (tree == null || path == null || !path.isResolvable()) {
            return Optional.empty();
        }

        ConfigValue current = tree;
        for (String segment : path.segments()) {
            if (!(current instanceof MapValue map)) {
                return Optional.empty();
            }
            Optional<ConfigValue> child = map.get(segment);
            if (child.isEmpty()) {
                return Optional.empty();
            }
            current = child.get();
        }
        return Optional.of(current);
    }

    /**
     * Parses and resolves a dotted path.
     *
     * @param tree root value
     * @param path dotted attribute path
     * @return resolved value, or empty if absent
     */
    public static Optional<ConfigValue> resolve(ConfigValue tree, String path) {
        if (path == null) {
            return Optional.empty();
        }
        return resolve(tree, AttributePath.parse(path));
    }
}
