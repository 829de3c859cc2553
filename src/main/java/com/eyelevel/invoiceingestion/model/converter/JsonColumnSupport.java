package com.eyelevel.invoiceingestion.model.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Shared mapper for JSON-typed columns. Converters are instantiated by Hibernate, so they cannot rely on
 * the application's ObjectMapper bean.
 */
final class JsonColumnSupport {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
                                                         .findAndAddModules()
                                                         .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                                                         .build();

    private JsonColumnSupport() {
    }

    static String write(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not serialize column value of type " + value.getClass(), e);
        }
    }

    static <T> T read(String json, TypeReference<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not deserialize column value", e);
        }
    }
}
