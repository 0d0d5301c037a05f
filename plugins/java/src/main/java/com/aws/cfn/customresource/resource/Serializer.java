package com.aws.cfn.customresource.resource;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.inject.Inject;
import lombok.Getter;

public class Serializer {

    @Getter
    private final ObjectMapper objectMapper;

    public Serializer() {
        this(configureObjectMapper(new ObjectMapper()));
    }

    @Inject
    public Serializer(final ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Configures the specified ObjectMapper with the (de)serialization behaviours we want to enforce;
     * resource properties must match their type exactly, unknown keys are a decode failure. A handler
     * result without properties is sent as an empty object.
     * @param objectMapper the mapper to configure
     * @return the same mapper
     */
    public static ObjectMapper configureObjectMapper(final ObjectMapper objectMapper) {
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
        objectMapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        return objectMapper;
    }

    public String serialize(final Object value) throws JsonProcessingException {
        return this.objectMapper.writeValueAsString(value);
    }

    /**
     * Converts an arbitrary handler result to a generic JSON tree
     * @throws IllegalArgumentException if the value cannot be serialized
     */
    public JsonNode toTree(final Object value) {
        return this.objectMapper.valueToTree(value);
    }
}
