package com.eyelevel.flambientprocessor.model.converter;

import com.eyelevel.flambientprocessor.common.json.JsonParser;
import com.eyelevel.flambientprocessor.common.json.JsonSerializer;
import com.eyelevel.flambientprocessor.common.json.jackson.JacksonJsonParser;
import com.eyelevel.flambientprocessor.common.json.jackson.JacksonJsonSerializer;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

/**
 * Stores an ordered list of file names as a JSON array column.
 */
@Converter
public class StringListConverter implements AttributeConverter<List<String>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonSerializer SERIALIZER = new JacksonJsonSerializer(MAPPER);
    private static final JsonParser PARSER = new JacksonJsonParser(MAPPER);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    @Override
    public String convertToDatabaseColumn(List<String> attribute) {
        return SERIALIZER.serialize(attribute == null ? List.of() : attribute);
    }

    @Override
    public List<String> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(PARSER.parseObject(dbData, STRING_LIST));
    }
}
