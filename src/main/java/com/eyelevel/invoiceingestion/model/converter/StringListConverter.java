package com.eyelevel.invoiceingestion.model.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class StringListConverter implements AttributeConverter<List<String>, String> {

    private static final TypeReference<ArrayList<String>> TYPE = new TypeReference<>() {
    };

    @Override
    public String convertToDatabaseColumn(List<String> attribute) {
        return JsonColumnSupport.write(attribute);
    }

    @Override
    public List<String> convertToEntityAttribute(String dbData) {
        List<String> value = JsonColumnSupport.read(dbData, TYPE);
        return value != null ? value : new ArrayList<>();
    }
}
