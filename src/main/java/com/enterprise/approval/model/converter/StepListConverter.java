package com.enterprise.approval.model.converter;

import java.util.List;

import com.enterprise.approval.model.StepDefinition;
import com.fasterxml.jackson.core.type.TypeReference;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class StepListConverter implements AttributeConverter<List<StepDefinition>, String> {

    private static final TypeReference<List<StepDefinition>> TYPE = new TypeReference<>() {
    };

    @Override
    public String convertToDatabaseColumn(List<StepDefinition> steps) {
        return JsonConverterSupport.write(steps);
    }

    @Override
    public List<StepDefinition> convertToEntityAttribute(String json) {
        List<StepDefinition> steps = JsonConverterSupport.read(json, TYPE);
        return steps == null ? List.of() : List.copyOf(steps);
    }
}
