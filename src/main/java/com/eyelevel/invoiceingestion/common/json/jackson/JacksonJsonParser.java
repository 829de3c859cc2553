package com.eyelevel.invoiceingestion.common.json.jackson;

import com.eyelevel.invoiceingestion.common.json.JsonParser;
import com.eyelevel.invoiceingestion.exception.json.JsonParsingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Implementation of the {@link JsonParser} interface using the application's Jackson {@link ObjectMapper},
 * so polymorphic job payloads and Java time values are read with the same settings they were written with.
 */
@Component("jacksonJsonParser")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonParser implements JsonParser {

    private final ObjectMapper objectMapper;

    @Override
    public <T> T parseObject(String json, Class<T> valueType) {
        log.debug("Parsing JSON string to object of type: {}", valueType.getName());
        try {
            T result = objectMapper.readValue(json, valueType);
            log.trace("Parsing JSON successful: {}", result);
            return result;
        } catch (IOException e) {
            log.error("Error parsing JSON string to object of type: {}", valueType.getName(), e);
            throw new JsonParsingException("Error parsing JSON string", e);
        }
    }
}
