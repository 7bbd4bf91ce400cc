package com.terradrift.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * One attribute's disagreement between the live resource and its declared configuration.
 *
 * <p>A record is only created when the two sides disagree on presence or on value.
 * A value is carried for each side the attribute is present on.
 *
 * @param attribute the checked attribute path
 * @param presentInLive whether the live resource has the attribute
 * @param presentInDeclared whether the declared configuration has the attribute
 * @param liveValue live value, null when not present in live
 * @param declaredValue declared value, null when not present in declared
 */
public record DriftRecord(
    AttributePath attribute,
    boolean presentInLive,
    boolean presentInDeclared,
    ConfigValue liveValue,
    ConfigValue declaredValue
) {
    /**
     * Compact constructor with validation.
     */
    public DriftRecord {
        Objects.requireNonNull(attribute, "attribute must not be null");
        if (!presentInLive && !presentInDeclared) {
            throw new IllegalArgumentException("Drift record for " + attribute + " must be present on at least one side");
        }
        if (presentInLive != (liveValue != null)) {
            throw new IllegalArgumentException("liveValue must be set exactly when presentInLive is true");
        }
        if (presentInDeclared != (declaredValue != null)) {
            throw new IllegalArgumentException("declaredValue must be set exactly when presentInDeclared is true");
        }
    }

    public static DriftRecord onlyInLive(AttributePath attribute, ConfigValue liveValue) {
        return new DriftRecord(attribute, true, false, liveValue, null);
    }

    public static DriftRecord onlyInDeclared(AttributePath attribute, ConfigValue declaredValue) {
        return new DriftRecord(attribute, false, true, null, declaredValue);
    }

    public static DriftRecord mismatch(AttributePath attribute, ConfigValue liveValue, ConfigValue declaredValue) {
        return new DriftRecord(attribute, true, true, liveValue, declaredValue);
    }

    /**
     * Derives the classification from the presence flags.
     *
     * @return drift status
     */
    public DriftStatus status() {
        if (presentInLive && presentInDeclared) {
            return DriftStatus.VALUE_MISMATCH;
        }
        return presentInLive ? DriftStatus.ONLY_IN_LIVE : DriftStatus.ONLY_IN_DECLARED;
    }

    public Optional<ConfigValue> live() {
        return Optional.ofNullable(liveValue);
    }

    public Optional<ConfigValue> declared() {
        return Optional.ofNullable(declaredValue);
    }
}
