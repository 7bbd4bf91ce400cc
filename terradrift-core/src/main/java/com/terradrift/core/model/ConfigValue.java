package com.terradrift.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Normalized representation of any configuration value.
 *
 * <p>Both sides of a drift comparison are converted into this closed set of shapes before
 * they reach the comparison engine, so the engine never needs to know whether a value came
 * from the AWS API or from a Terraform file.
 *
 * <ul>
 *   <li>{@link NullValue} - explicit null</li>
 *   <li>{@link BoolValue} - boolean</li>
 *   <li>{@link NumberValue} - any numeric value, widened to {@code double}</li>
 *   <li>{@link StringValue} - text</li>
 *   <li>{@link ListValue} - ordered sequence (compared as a multiset)</li>
 *   <li>{@link MapValue} - string-keyed mapping (compared as an unordered key set)</li>
 * </ul>
 *
 * <p>Record {@code equals()} is structural and order-sensitive for lists. Drift detection
 * must use {@link com.terradrift.core.compare.ConfigEquality} instead.
 */
public sealed interface ConfigValue
    permits ConfigValue.NullValue, ConfigValue.BoolValue, ConfigValue.NumberValue,
            ConfigValue.StringValue, ConfigValue.ListValue, ConfigValue.MapValue {

    /**
     * Returns the tag of this value.
     *
     * @return value kind
     */
    Kind kind();

    /**
     * Converts this value back into plain Java objects ({@code null}, {@link Boolean},
     * {@link Long} or {@link Double}, {@link String}, {@link List}, {@link Map}).
     *
     * <p>Integral numbers are returned as {@link Long} so serialized output shows {@code 8}
     * rather than {@code 8.0}.
     *
     * @return plain Java representation
     */
    Object toPlainObject();

    /**
     * Compact human-readable rendering used by the text report.
     *
     * @return display string
     */
    String toDisplayString();

    static ConfigValue nullValue() {
        return NullValue.INSTANCE;
    }

    static ConfigValue of(boolean value) {
        return new BoolValue(value);
    }

    static ConfigValue of(double value) {
        return new NumberValue(value);
    }

    static ConfigValue of(String value) {
        return new StringValue(value);
    }

    static ConfigValue list(ConfigValue... elements) {
        return new ListValue(List.of(elements));
    }

    /**
     * Value tags.
     */
    enum Kind {
        NULL,
        BOOL,
        NUMBER,
        STRING,
        LIST,
        MAP
    }

    /**
     * The null value. Use {@link ConfigValue#nullValue()}.
     */
    record NullValue() implements ConfigValue {
        static final NullValue INSTANCE = new NullValue();

        @Override
        public Kind kind() {
            return Kind.NULL;
        }

        @Override
        public Object toPlainObject() {
            return null;
        }

        @Override
        public String toDisplayString() {
            return "null";
        }
    }

    /**
     * @param value boolean content
     */
    record BoolValue(boolean value) implements ConfigValue {
        @Override
        public Kind kind() {
            return Kind.BOOL;
        }

        @Override
        public Object toPlainObject() {
            return value;
        }

        @Override
        public String toDisplayString() {
            return Boolean.toString(value);
        }
    }

    /**
     * @param value numeric content, always double precision
     */
    record NumberValue(double value) implements ConfigValue {
        @Override
        public Kind kind() {
            return Kind.NUMBER;
        }

        /**
         * Returns true if the value has no fractional part and fits in a {@code long}.
         *
         * @return true for integral values
         */
        public boolean isIntegral() {
            return !Double.isInfinite(value)
                && value == Math.rint(value)
                && Math.abs(value) < 0x1p63;
        }

        @Override
        public Object toPlainObject() {
            return isIntegral() ? (Object) (long) value : (Object) value;
        }

        @Override
        public String toDisplayString() {
            return isIntegral() ? Long.toString((long) value) : Double.toString(value);
        }
    }

    /**
     * @param value text content
     */
    record StringValue(String value) implements ConfigValue {
        public StringValue {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.STRING;
        }

        @Override
        public Object toPlainObject() {
            return value;
        }

        @Override
        public String toDisplayString() {
            return '"' + value + '"';
        }
    }

    /**
     * @param elements list elements, copied defensively
     */
    record ListValue(List<ConfigValue> elements) implements ConfigValue {
        public ListValue {
            Objects.requireNonNull(elements, "elements must not be null");
            elements = List.copyOf(elements);
        }

        @Override
        public Kind kind() {
            return Kind.LIST;
        }

        public int size() {
            return elements.size();
        }

        @Override
        public Object toPlainObject() {
            List<Object> plain = new ArrayList<>(elements.size());
            for (ConfigValue element : elements) {
                plain.add(element.toPlainObject());
            }
            return Collections.unmodifiableList(plain);
        }

        @Override
        public String toDisplayString() {
            return elements.stream()
                .map(ConfigValue::toDisplayString)
                .collect(Collectors.joining(" ", "[", "]"));
        }
    }

    /**
     * Insertion-ordered, string-keyed map.
     *
     * @param entries map entries, copied defensively with insertion order kept
     */
    record MapValue(Map<String, ConfigValue> entries) implements ConfigValue {
        public MapValue {
            Objects.requireNonNull(entries, "entries must not be null");
            Map<String, ConfigValue> copy = new LinkedHashMap<>();
            entries.forEach((key, value) -> copy.put(
                Objects.requireNonNull(key, "map key must not be null"),
                Objects.requireNonNull(value, "map value must not be null")));
            entries = Collections.unmodifiableMap(copy);
        }

        /**
         * Returns an empty map value.
         *
         * @return empty map
         */
        public static MapValue empty() {
            return new MapValue(Map.of());
        }

        @Override
        public Kind kind() {
            return Kind.MAP;
        }

        /**
         * Looks up a direct child.
         *
         * @param key map key
         * @return child value, or empty if the key is absent
         */
        public Optional<ConfigValue> get(String key) {
            return Optional.ofNullable(entries.get(key));
        }

        public int size() {
            return entries.size();
        }

        @Override
        public Object toPlainObject() {
            Map<String, Object> plain = new LinkedHashMap<>();
            entries.forEach((key, value) -> plain.put(key, value.toPlainObject()));
            return Collections.unmodifiableMap(plain);
        }

        @Override
        public String toDisplayString() {
            return entries.entrySet().stream()
                .map(e -> e.getKey() + ":" + e.getValue().toDisplayString())
                .collect(Collectors.joining(" ", "map[", "]"));
        }
    }
}
