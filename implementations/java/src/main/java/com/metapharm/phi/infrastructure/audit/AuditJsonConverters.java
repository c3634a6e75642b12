package com.metapharm.phi.infrastructure.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON column converters for {@link AuditTrailEntry}.
 */
final class AuditJsonConverters {

    private static final ObjectMapper MAPPER = new ObjectMapper().findAndRegisterModules();

    private AuditJsonConverters() {
    }

    private static String write(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize audit column: " + e.getOriginalMessage(), e);
        }
    }

    private static <T> T read(String json, TypeReference<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot read audit column: " + e.getOriginalMessage(), e);
        }
    }

    @Converter
    static class ChangesConverter implements AttributeConverter<Map<String, FieldChange>, String> {

        private static final TypeReference<LinkedHashMap<String, FieldChange>> TYPE = new TypeReference<>() {
        };

        @Override
        public String convertToDatabaseColumn(Map<String, FieldChange> attribute) {
            return write(attribute);
        }

        @Override
        public Map<String, FieldChange> convertToEntityAttribute(String dbData) {
            return read(dbData, TYPE);
        }
    }

    @Converter
    static class DeviceInfoConverter implements AttributeConverter<DeviceInfo, String> {

        private static final TypeReference<DeviceInfo> TYPE = new TypeReference<>() {
        };

        @Override
        public String convertToDatabaseColumn(DeviceInfo attribute) {
            return write(attribute);
        }

        @Override
        public DeviceInfo convertToEntityAttribute(String dbData) {
            return read(dbData, TYPE);
        }
    }
}
