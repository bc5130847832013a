package com.leadgen.backend.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.leadgen.backend.models.ResearchPayload;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JPA converters that keep structured columns as JSON text, so the schema stays portable
 * between PostgreSQL and the H2 database used in tests.
 */
public final class JsonConverters {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JsonConverters() {
    }

    static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize column value: " + e.getOriginalMessage(), e);
        }
    }

    static <T> T read(String json, TypeReference<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot deserialize column value: " + e.getOriginalMessage(), e);
        }
    }

    @Converter
    public static class StringListConverter implements AttributeConverter<List<String>, String> {

        @Override
        public String convertToDatabaseColumn(List<String> attribute) {
            return attribute == null ? null : write(attribute);
        }

        @Override
        public List<String> convertToEntityAttribute(String dbData) {
            if (dbData == null || dbData.isBlank()) {
                return new ArrayList<>();
            }
            return read(dbData, new TypeReference<List<String>>() {});
        }
    }

    @Converter
    public static class MapConverter implements AttributeConverter<Map<String, Object>, String> {

        @Override
        public String convertToDatabaseColumn(Map<String, Object> attribute) {
            return attribute == null || attribute.isEmpty() ? null : write(attribute);
        }

        @Override
        public Map<String, Object> convertToEntityAttribute(String dbData) {
            if (dbData == null || dbData.isBlank()) {
                return new LinkedHashMap<>();
            }
            return read(dbData, new TypeReference<LinkedHashMap<String, Object>>() {});
        }
    }

    @Converter
    public static class ResearchPayloadConverter implements AttributeConverter<ResearchPayload, String> {

        @Override
        public String convertToDatabaseColumn(ResearchPayload attribute) {
            return attribute == null ? null : write(attribute);
        }

        @Override
        public ResearchPayload convertToEntityAttribute(String dbData) {
            if (dbData == null || dbData.isBlank()) {
                return null;
            }
            return read(dbData, new TypeReference<ResearchPayload>() {});
        }
    }
}
