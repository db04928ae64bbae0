package com.classpulse.engage.repository;

import com.classpulse.engage.error.DataIntegrityException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON text columns and timestamp conversion shared by the JDBC repositories.
 */
@Component
public class JsonColumns {
    static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    static final TypeReference<LinkedHashMap<String, Integer>> SCORES = new TypeReference<>() {};
    static final TypeReference<LinkedHashMap<String, Object>> OBJECT_MAP = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public JsonColumns(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(Object value) {
        if (value == null) return null;
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value cannot be stored as JSON: " + value.getClass().getSimpleName(), e);
        }
    }

    public <T> T read(String json, TypeReference<T> type) {
        if (json == null || json.isBlank()) return null;
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new DataIntegrityException("CORRUPT_JSON_COLUMN", "Stored JSON could not be read", e);
        }
    }

    public <T> T read(String json, Class<T> type) {
        if (json == null || json.isBlank()) return null;
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new DataIntegrityException("CORRUPT_JSON_COLUMN", "Stored JSON could not be read", e);
        }
    }

    public List<String> readStrings(String json) {
        List<String> values = read(json, STRING_LIST);
        return values == null ? List.of() : List.copyOf(values);
    }

    public Map<String, Integer> readScores(String json) {
        return read(json, SCORES);
    }

    static Timestamp ts(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    static Instant instant(ResultSet rs, int column) throws SQLException {
        Timestamp value = rs.getTimestamp(column);
        return value == null ? null : value.toInstant();
    }
}
