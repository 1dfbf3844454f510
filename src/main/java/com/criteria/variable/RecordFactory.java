package com.criteria.variable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.HashMap;
import java.util.Map;

/**
 * Factory for creating evaluation records from JSON payloads.
 * Nested JSON objects are flattened using dot notation (e.g., {"x":{"y":"z"}} becomes "x.y" -> "z").
 */
public final class RecordFactory {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private RecordFactory() {
    }

    /**
     * Create a flattened record from a JSON object payload.
     *
     * @param jsonPayload JSON object
     * @return Record keyed by dotted field names; empty for a blank payload
     */
    public static Map<String, Object> fromJson(String jsonPayload) {
        if (jsonPayload == null || jsonPayload.isBlank()) {
            return Map.of();
        }
        return flatten(parseJson(jsonPayload));
    }

    private static Map<String, Object> parseJson(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON payload: " + e.getMessage(), e);
        }
    }

    /**
     * Flatten nested maps into dot-notation keys.
     * Lists are kept as values, not flattened.
     */
    public static Map<String, Object> flatten(Map<String, ?> map) {
        Map<String, Object> result = new HashMap<>();
        flattenRecursive("", map, result);
        return result;
    }

    @SuppressWarnings("unchecked")
    private static void flattenRecursive(String prefix, Map<String, ?> map, Map<String, Object> result) {
        for (Map.Entry<String, ?> entry : map.entrySet()) {
            String key = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            Object value = entry.getValue();

            if (value instanceof Map) {
                flattenRecursive(key, (Map<String, Object>) value, result);
            } else {
                result.put(key, value);
            }
        }
    }
}
