package com.eyelevel.invoiceingestion.model.converter;

import com.eyelevel.invoiceingestion.model.FieldDefinition;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.LinkedHashMap;
import java.util.Map;

@Converter
public class FieldDefinitionsConverter implements AttributeConverter<Map<String, FieldDefinition>, String> {

    private static final TypeReference<LinkedHashMap<String, FieldDefinition>> TYPE = new TypeReference<>() {
    };

    @Override
    public String convertToDatabaseColumn(Map<String, FieldDefinition> attribute) {
        return JsonColumnSupport.write(attribute);
    }

    @Override
    public Map<String, FieldDefinition> convertToEntityAttribute(String dbData) {
        Map<String, FieldDefinition> value = JsonColumnSupport.read(dbData, TYPE);
        return value != null ? value : new LinkedHashMap<>();
    }
}
