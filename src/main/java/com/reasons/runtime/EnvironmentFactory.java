package com.reasons.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Creates a RuntimeEnvironment from a JSON document.
 * Nested objects are flattened using dot notation ({"order":{"total":5}}
 * defines {@code order.total}), and the top-level objects stay available as
 * maps for property access.
 */
public final class EnvironmentFactory {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private EnvironmentFactory() {
    }

    public static RuntimeEnvironment fromJson(String json) {
        return fromJson(json, RuntimeEnvironment.builder());
    }

    /**
     * Add the variables of a JSON object to a builder and build it.
     *
     * @param json    JSON object text, may be null or blank
     * @param builder Builder carrying any extra variables or functions
     * @throws IllegalArgumentException if the payload is not a JSON object
     */
    public static RuntimeEnvironment fromJson(String json, RuntimeEnvironment.Builder builder) {
        if (json != null && !json.isBlank()) {
            Map<String, Object> parsed = parseJson(json);
            builder.variables(parsed);
            builder.variables(flatten(parsed));
        }
        return builder.build();
    }

    private static Map<String, Object> parseJson(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON payload: " + e.getOriginalMessage(), e);
        }
    }

    private static Map<String, Object> flatten(Map<String, Object> map) {
        Map<String, Object> result = new LinkedHashMap<>();
        flattenRecursive("", map, result);
        return result;
    }

    @SuppressWarnings("unchecked")
    private static void flattenRecursive(String prefix, Map<String, Object> map, Map<String, Object> result) {
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            String key = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            Object value = entry.getValue();
            if (value instanceof Map) {
                flattenRecursive(key, (Map<String, Object>) value, result);
            } else if (!prefix.isEmpty()) {
                result.put(key, value);
            }
        }
    }
}
