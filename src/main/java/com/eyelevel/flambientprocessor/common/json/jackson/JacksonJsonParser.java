package com.eyelevel.flambientprocessor.common.json.jackson;


import com.eyelevel.flambientprocessor.common.json.JsonParser;
import com.eyelevel.flambientprocessor.exception.json.JsonParsingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Implementation of the {@link JsonParser} interface using the Jackson library.
 */
@Component("jacksonJsonParser")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonParser implements JsonParser {

    private final ObjectMapper objectMapper;

    @Override
    public <T> T parseObject(String json, Class<T> valueType) {
        log.debug("Parsing JSON string to object of type: {}", valueType.getName());
        if (json == null) {
            throw new JsonParsingException("Cannot parse a null JSON string into " + valueType.getSimpleName());
        }
        return parseJson(json.getBytes(StandardCharsets.UTF_8), valueType);
    }

    @Override
    public <T> T parseObject(byte[] jsonBytes, Class<T> valueType) {
        log.debug("Parsing JSON byte array to object of type: {}", valueType.getName());
        if (jsonBytes == null || jsonBytes.length == 0) {
            throw new JsonParsingException("Cannot parse an empty response body into " + valueType.getSimpleName());
        }
        return parseJson(jsonBytes, valueType);
    }

    @Override
    public <T> T parseObject(String json, TypeReference<T> typeRef) {
        log.trace("Parsing JSON with TypeReference: {}", typeRef.getType());
        try {
            return objectMapper.readValue(json, typeRef);
        } catch (IOException e) {
            log.error("Error parsing JSON with TypeReference: {}", typeRef.getType(), e);
            throw new JsonParsingException("Error parsing JSON with TypeReference", e);
        }
    }

    private <T> T parseJson(byte[] jsonBytes, Class<T> valueType) {
        try {
            T result = objectMapper.readValue(jsonBytes, valueType);
            log.trace("Parsing JSON successful: {}", result);
            return result;
        } catch (IOException e) {
            log.error("Error parsing JSON with Class: {}", valueType.getName(), e);
            throw new JsonParsingException("Error parsing JSON with Class " + valueType.getSimpleName(), e);
        }
    }
}
