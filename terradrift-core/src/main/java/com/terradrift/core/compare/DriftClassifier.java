package com.terradrift.core.compare;

import com.terradrift.core.model.AttributePath;
import com.terradrift.core.model.ConfigValue;
import com.terradrift.core.model.DriftRecord;
import com.terradrift.core.model.DriftReport;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Compares a live tree with a declared tree over an attribute checklist.
 *
 * <p>For each attribute:
 * <ol>
 *   <li>absent on both sides: nothing recorded</li>
 *   <li>present on one side only: a presence record for that side</li>
 *   <li>present on both and equal: nothing recorded</li>
 *   <li>present on both and different: a mismatch record with both values</li>
 * </ol>
 *
 * <p>Attributes outside the checklist are never inspected. The classifier performs no I/O and
 * holds no mutable state, so one instance can serve concurrent comparisons.
 */
public class DriftClassifier {

    private final Clock clock;

    public DriftClassifier() {
        this(Clock.systemUTC());
    }

    public DriftClassifier(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Builds the drift report for one resource.
     *
     * @param resourceId resource identifier recorded in the report
     * @param live normalized tree from the live resource
     * @param declared normalized tree from the declarative source
     * @param options attribute checklist and list matching strategy
     * @return drift report, empty if every checked attribute agrees
     */
    public DriftReport classify(String resourceId, ConfigValue live, ConfigValue declared, ComparisonOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        ConfigEquality equality = ConfigEquality.using(options.matching());

        Map<String, DriftRecord> records = new LinkedHashMap<>();
        for (AttributePath attribute : options.attributes()) {
            if (records.containsKey(attribute.expression())) {
                continue;
            }
            compare(attribute, live, declared, equality).ifPresent(r -> records.put(attribute.expression(), r));
        }
        return new DriftReport(resourceId, clock.instant(), records);
    }

    /**
     * Compares a single attribute.
     *
     * @param attribute attribute path
     * @param live live tree
     * @param declared declared tree
     * @param equality equality engine
     * @return a drift record, or empty if the sides agree
     */
    Optional<DriftRecord> compare(AttributePath attribute, ConfigValue live, ConfigValue declared, ConfigEquality equality) {
        Optional<ConfigValue> liveValue = PathResolver.resolve(live, attribute);
        Optional<ConfigValue> declaredValue = PathResolver.resolve(declared, attribute);

        if (liveValue.isEmpty() && declaredValue.isEmpty()) {
            return Optional.empty();
        }
        if (declaredValue.isEmpty()) {
            return Optional.of(DriftRecord.onlyInLive(attribute, liveValue.get()));
        }
        if (liveValue.isEmpty()) {
            return Optional.of(DriftRecord.onlyInDeclared(attribute, declaredValue.get()));
        }
        if (equality.equal(liveValue.get(), declaredValue.get())) {
            return Optional.empty();
        }
        return Optional.of(DriftRecord.mismatch(attribute, liveValue.get(), declaredValue.get()));
    }
}
