package com.terradrift.cli;

import com.terradrift.core.compare.ComparisonOptions;
import com.terradrift.core.compare.MatchingStrategy;
import com.terradrift.core.config.TerraDriftConfig;
import com.terradrift.core.error.ConfigurationException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Merges command-line overrides with {@code terradrift.yaml} values.
 */
final class CheckSettings {

    private CheckSettings() {
        // Utility class
    }

    /**
     * Builds comparison options: command-line values win over the settings file.
     *
     * @param config loaded settings
     * @param attributes attributes from the command line, may be null
     * @param matching matching strategy from the command line, may be null
     * @return comparison options
     * @throws ConfigurationException if the matching strategy is unknown
     */
    static ComparisonOptions comparisonOptions(TerraDriftConfig config, List<String> attributes, String matching) {
        ComparisonOptions options;
        try {
            options = config.check().toComparisonOptions();
            if (matching != null && !matching.isBlank()) {
                options = options.withMatching(MatchingStrategy.fromString(matching));
            }
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown matching strategy. Available: "
                + Arrays.toString(MatchingStrategy.values()).toLowerCase(Locale.ROOT));
        }

        List<String> checklist = trimmed(attributes);
        if (!checklist.isEmpty()) {
            options = ComparisonOptions.of(checklist).withMatching(options.matching());
        }
        return options;
    }

    /**
     * Trims each value and drops blanks.
     *
     * @param values raw values, may be null
     * @return cleaned values
     */
    static List<String> trimmed(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream().map(String::trim).filter(v -> !v.isEmpty()).toList();
    }
}
