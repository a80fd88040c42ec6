package com.example.counseling.shared.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Utility class for the JSON object columns (notification metadata).
 */
@Slf4j
public final class JsonUtils {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private JsonUtils() {}

    /**
     * Parses a JSON object string into a Map.
     *
     * @param json The JSON string to parse.
     * @return The parsed map, or an empty map if parsing fails or the input is null/empty.
     */
    public static Map<String, Object> parseJsonObject(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (Exception e) {
            log.warn("Failed to parse JSON object string: {}", json, e);
            return new LinkedHashMap<>();
        }
    }

    /**
     * Converts a Map into a JSON object string. A null map is stored as an empty object.
     */
    public static String toJsonObject(Map<String, ?> map) {
        if (map == null || map.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(map);
        } catch (Exception e) {
            log.error("Failed to serialize map to JSON object string", e);
            return "{}";
        }
    }
}
