package com.aiusage.attribution.domain.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.math.BigDecimal;
import java.util.Map;
import java.util.TreeMap;

/**
 * Stores a metric map as a JSON text column.
 */
@Converter
public class MetricMapConverter implements AttributeConverter<Map<String, BigDecimal>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private static final TypeReference<TreeMap<String, BigDecimal>> TYPE = new TypeReference<>() {
    };

    @Override
    public String convertToDatabaseColumn(Map<String, BigDecimal> metrics) {
        if (metrics == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(new TreeMap<>(metrics));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize metric map", e);
        }
    }

    @Override
    public Map<String, BigDecimal> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return new TreeMap<>();
        }
        try {
            return MAPPER.readValue(json, TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot deserialize metric map", e);
        }
    }
}
