package com.eyelevel.flambientprocessor.model.converter;

import com.eyelevel.flambientprocessor.common.json.JsonParser;
import com.eyelevel.flambientprocessor.common.json.JsonSerializer;
import com.eyelevel.flambientprocessor.common.json.jackson.JacksonJsonParser;
import com.eyelevel.flambientprocessor.common.json.jackson.JacksonJsonSerializer;
import com.eyelevel.flambientprocessor.dto.imagen.EditOptions;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class EditOptionsConverter implements AttributeConverter<EditOptions, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonSerializer SERIALIZER = new JacksonJsonSerializer(MAPPER);
    private static final JsonParser PARSER = new JacksonJsonParser(MAPPER);

    @Override
    public String convertToDatabaseColumn(EditOptions attribute) {
        return attribute == null ? null : SERIALIZER.serialize(attribute);
    }

    @Override
    public EditOptions convertToEntityAttribute(String dbData) {
        return dbData == null || dbData.isBlank() ? null : PARSER.parseObject(dbData, EditOptions.class);
    }
}
