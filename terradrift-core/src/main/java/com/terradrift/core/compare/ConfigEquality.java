package com.terradrift.core.compare;

import com.terradrift.core.model.ConfigValue;
import com.terradrift.core.model.ConfigValue.BoolValue;
import com.terradrift.core.model.ConfigValue.ListValue;
import com.terradrift.core.model.ConfigValue.MapValue;
import com.terradrift.core.model.ConfigValue.NumberValue;
import com.terradrift.core.model.ConfigValue.StringValue;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Deep structural equality over {@link ConfigValue}.
 *
 * <ul>
 *   <li>{@code Null} equals only {@code Null}</li>
 *   <li>Scalars are equal iff they have the same tag and value. Numbers use {@code ==} on
 *       doubles, except that {@code NaN} equals {@code NaN}</li>
 *   <li>Maps are equal iff they have the same key set and every value is equal</li>
 *   <li>Lists are equal iff they have the same length and their elements can be paired
 *       one-to-one with equal elements, ignoring order (multiset equality). Pairing follows
 *       the configured {@link MatchingStrategy}</li>
 * </ul>
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class ConfigEquality {

    private static final ConfigEquality GREEDY = new ConfigEquality(MatchingStrategy.GREEDY);
    private static final ConfigEquality BIPARTITE = new ConfigEquality(MatchingStrategy.BIPARTITE);

    private final MatchingStrategy strategy;

    private ConfigEquality(MatchingStrategy strategy) {
        this.strategy = strategy;
    }

    /**
     * Returns the equality engine for a matching strategy.
     *
     * @param strategy list matching strategy
     * @return equality engine
     */
    public static ConfigEquality using(MatchingStrategy strategy) {
        Objects.requireNonNull(strategy, "strategy must not be null");
        return strategy == MatchingStrategy.GREEDY ? GREEDY : BIPARTITE;
    }

    public MatchingStrategy getStrategy() {
        return strategy;
    }

    /**
     * Compares two values.
     *
     * @param a first value
     * @param b second value
     * @return true if the values are structurally equal
     */
    public boolean equal(ConfigValue a, ConfigValue b) {
        Objects.requireNonNull(a, "a must not be null");
        Objects.requireNonNull(b, "b must not be null");

        if (a.kind() != b.kind()) {
            return false;
        }
        return switch (a.kind()) {
            case NULL -> true;
            case BOOL -> ((BoolValue) a).value() == ((BoolValue) b).value();
            case NUMBER -> numbersEqual(((NumberValue) a).value(), ((NumberValue) b).value());
            case STRING -> ((StringValue) a).value().equals(((StringValue) b).value());
            case MAP -> mapsEqual((MapValue) a, (MapValue) b);
            case LIST -> listsEqual((ListValue) a, (ListValue) b);
        };
    }

    private static boolean numbersEqual(double a, double b) {
        return a == b || (Double.isNaN(a) && Double.isNaN(b));
    }

    private boolean mapsEqual(MapValue a, MapValue b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (Map.Entry<String, ConfigValue> entry : a.entries().entrySet()) {
            ConfigValue other = b.entries().get(entry.getKey());
            if (other == null || !equal(entry.getValue(), other)) {
                return false;
            }
        }
        return true;
    }

    private boolean listsEqual(ListValue a, ListValue b) {
        if (a.size() != b.size()) {
            return false;
        }
        if (a.size() == 0) {
            return true;
        }
        return switch (strategy) {
            case GREEDY -> greedyMatch(a.elements(), b.elements());
            case BIPARTITE -> perfectMatch(a.elements(), b.elements());
        };
    }

    private boolean greedyMatch(List<ConfigValue> left, List<ConfigValue> right) {
        boolean[] taken = new boolean[right.size()];
        for (ConfigValue element : left) {
            boolean found = false;
            for (int j = 0; j < right.size(); j++) {
                if (!taken[j] && equal(element, right.get(j))) {
                    taken[j] = true;
                    found = true;
                    break;
                }
            }
            if (!found) {
                return false;
            }
        }
        return true;
    }

    /**
     * Kuhn's augmenting-path algorithm over the "is equal" relation. Element comparisons are
     * computed once into an adjacency matrix since each may itself be a deep comparison.
     */
    private boolean perfectMatch(List<ConfigValue> left, List<ConfigValue> right) {
        int n = left.size();
        boolean[][] adjacent = new boolean[n][n];
        for (int i = 0; i < n; i++) {
            boolean any = false;
            for (int j = 0; j < n; j++) {
                adjacent[i][j] = equal(left.get(i), right.get(j));
                any |= adjacent[i][j];
            }
            if (!any) {
                return false;
            }
        }

        int[] matchOfRight = new int[n];
        Arrays.fill(matchOfRight, -1);
        for (int i = 0; i < n; i++) {
            if (!augment(i, adjacent, matchOfRight, new boolean[n])) {
                return false;
            }
        }
        return true;
    }

    private static boolean augment(int leftIndex, boolean[][] adjacent, int[] matchOfRight, boolean[] visited) {
        for (int j = 0; j < matchOfRight.length; j++) {
            if (!adjacent[leftIndex][j] || visited[j]) {
                continue;
            }
            visited[j] = true;
            if (matchOfRight[j] < 0 || augment(matchOfRight[j], adjacent, matchOfRight, visited)) {
                matchOfRight[j] = leftIndex;
                return true;
            }
        }
        return false;
    }
}
