package com.eyelevel.flambientprocessor.common.json;

import com.fasterxml.jackson.core.type.TypeReference;

/**
 * Defines the contract for parsing JSON data into Java objects.
 *
 * <p>Used for remote API response bodies and for the JSON-valued columns of the job record.
 */
public interface JsonParser {

    /**
     * Parses JSON data from a string into a Java object of the specified type.
     *
     * @param json      The JSON data as a string.
     * @param valueType The class of the Java object to parse the JSON into.
     * @param <T>       The type of the Java object.
     *
     * @return The parsed Java object.
     *
     * @throws com.eyelevel.flambientprocessor.exception.json.JsonParsingException if the JSON is malformed.
     */
    <T> T parseObject(String json, Class<T> valueType);

    /**
     * Parses JSON data from a byte array into a Java object of the specified type.
     *
     * @param jsonBytes The JSON data as a byte array.
     * @param valueType The class of the Java object to parse the JSON into.
     * @param <T>       The type of the Java object.
     *
     * @return The parsed Java object.
     *
     * @throws com.eyelevel.flambientprocessor.exception.json.JsonParsingException if the JSON is malformed.
     */
    <T> T parseObject(byte[] jsonBytes, Class<T> valueType);

    /**
     * Parses JSON data from a string into a generic type such as {@code List<String>}.
     *
     * @param json    The JSON data as a string.
     * @param typeRef The full generic type to bind to.
     * @param <T>     The type of the Java object.
     *
     * @return The parsed Java object.
     */
    <T> T parseObject(String json, TypeReference<T> typeRef);
}
