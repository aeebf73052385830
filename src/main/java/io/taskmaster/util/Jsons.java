package io.taskmaster.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class Jsons {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .enable(SerializationFeature.INDENT_OUTPUT);
    private static final ObjectMapper COMPACT = new ObjectMapper().findAndRegisterModules();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<ArrayList<String>> STRING_LIST_TYPE = new TypeReference<>() {
    };

    private Jsons() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize JSON", e);
        }
    }

    /**
     * Single-line JSON, used for values stored in SQLite columns.
     */
    public static String toCompactJson(Object value) {
        try {
            return COMPACT.writeValueAsString(value == null ? Map.of() : value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize JSON", e);
        }
    }

    public static Map<String, Object> toMap(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, Object> out = COMPACT.readValue(json, MAP_TYPE);
            return out == null ? new LinkedHashMap<>() : out;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON object: " + e.getOriginalMessage(), e);
        }
    }

    public static String toCompactJsonArray(List<String> values) {
        try {
            return COMPACT.writeValueAsString(values == null ? List.of() : values);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize JSON", e);
        }
    }

    public static List<String> toStringList(String json) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            List<String> out = COMPACT.readValue(json, STRING_LIST_TYPE);
            return out == null ? new ArrayList<>() : out;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON array: " + e.getOriginalMessage(), e);
        }
    }
}
