package com.wpanther.fpolifecycle.entity.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import jakarta.persistence.AttributeConverter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stores a map column as a JSON document. Insertion order survives the round trip
 * because Jackson materializes objects as {@link LinkedHashMap}.
 */
public abstract class AbstractJsonMapConverter<V> implements AttributeConverter<Map<String, V>, String> {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper().registerModule(new JavaTimeModule());

    private final TypeReference<LinkedHashMap<String, V>> typeReference;

    protected AbstractJsonMapConverter(TypeReference<LinkedHashMap<String, V>> typeReference) {
        this.typeReference = typeReference;
    }

    @Override
    public String convertToDatabaseColumn(Map<String, V> attribute) {
        if (attribute == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize map column: " + e.getMessage(), e);
        }
    }

    @Override
    public Map<String, V> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return OBJECT_MAPPER.readValue(dbData, typeReference);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize map column: " + e.getMessage(), e);
        }
    }
}
