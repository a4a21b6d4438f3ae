package com.enterprise.approval.model.converter;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Persists schemaless documents (request payloads, history metadata) as JSON text.
 */
@Converter
public class JsonDocumentConverter implements AttributeConverter<Map<String, Object>, String> {

    private static final TypeReference<LinkedHashMap<String, Object>> TYPE = new TypeReference<>() {
    };

    @Override
    public String convertToDatabaseColumn(Map<String, Object> document) {
        return JsonConverterSupport.write(document);
    }

    @Override
    public Map<String, Object> convertToEntityAttribute(String json) {
        return JsonConverterSupport.read(json, TYPE);
    }
}
