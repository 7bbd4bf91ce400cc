package com.terradrift.core.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.terradrift.core.model.ConfigValue;
import com.terradrift.core.model.ConfigValue.ListValue;
import com.terradrift.core.model.ConfigValue.MapValue;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Converts source-native values into {@link ConfigValue}.
 *
 * <p>Producers call this at their boundary; the comparison engine only ever sees the
 * normalized form.
 *
 * <p><b>Rules:</b>
 * <ul>
 *   <li>Every numeric type widens to a double {@link ConfigValue.NumberValue}, so {@code 8}
 *       and {@code 8.0} compare equal</li>
 *   <li>Maps become {@link MapValue} with {@code String.valueOf(key)} keys</li>
 *   <li>Collections, arrays and other iterables become {@link ListValue}</li>
 *   <li>Enums become their {@code name()}</li>
 *   <li>No coercion between strings and numbers or booleans: {@code "8"} stays a string
 *       and is reported as drift against {@code 8}</li>
 * </ul>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ConfigValue tree = ConfigNormalizer.normalize(Map.of(
 *     "instance_type", "t2.micro",
 *     "tags", Map.of("Name", "web")
 * ));
 * }</pre>
 */
public final class ConfigNormalizer {

    private ConfigNormalizer() {
        // Utility class
    }

    /**
     * Normalizes a plain Java value.
     *
     * @param value value to normalize, may be null
     * @return normalized value
     * @throws IllegalArgumentException if the value (or a nested value) has no normalized form
     */
    public static ConfigValue normalize(Object value) {
        if (value == null) {
            return ConfigValue.nullValue();
        }
        if (value instanceof ConfigValue configValue) {
            return configValue;
        }
        if (value instanceof JsonNode node) {
            return fromJson(node);
        }
        if (value instanceof Optional<?> optional) {
            return optional.map(ConfigNormalizer::normalize).orElse(ConfigValue.nullValue());
        }
        if (value instanceof Boolean bool) {
            return ConfigValue.of(bool);
        }
        if (value instanceof Number number) {
            return ConfigValue.of(number.doubleValue());
        }
        if (value instanceof CharSequence text) {
            return ConfigValue.of(text.toString());
        }
        if (value instanceof Character character) {
            return ConfigValue.of(character.toString());
        }
        if (value instanceof Enum<?> constant) {
            return ConfigValue.of(constant.name());
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, ConfigValue> entries = new LinkedHashMap<>();
            map.forEach((key, child) -> entries.put(String.valueOf(key), normalize(child)));
            return new MapValue(entries);
        }
        if (value instanceof Iterable<?> iterable) {
            List<ConfigValue> elements = new ArrayList<>();
            for (Object element : iterable) {
                elements.add(normalize(element));
            }
            return new ListValue(elements);
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<ConfigValue> elements = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                elements.add(normalize(Array.get(value, i)));
            }
            return new ListValue(elements);
        }
        throw new IllegalArgumentException(
            "Cannot normalize value of type " + value.getClass().getName());
    }

    /**
     * Normalizes a Jackson tree.
     *
     * @param node JSON node, may be null
     * @return normalized value
     */
    public static ConfigValue fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return ConfigValue.nullValue();
        }
        if (node.isObject()) {
            Map<String, ConfigValue> entries = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                entries.put(field.getKey(), fromJson(field.getValue()));
            }
            return new MapValue(entries);
        }
        if (node.isArray()) {
            List<ConfigValue> elements = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                elements.add(fromJson(element));
            }
            return new ListValue(elements);
        }
        if (node.isBoolean()) {
            return ConfigValue.of(node.booleanValue());
        }
        if (node.isNumber()) {
            return ConfigValue.of(node.doubleValue());
        }
        if (node.isTextual()) {
            return ConfigValue.of(node.textValue());
        }
        // Binary and POJO nodes do not occur in parsed JSON
        return ConfigValue.of(node.asText());
    }
}
