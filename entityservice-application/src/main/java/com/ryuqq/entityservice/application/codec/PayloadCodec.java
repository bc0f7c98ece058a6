package com.ryuqq.entityservice.application.codec;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ryuqq.entityservice.core.model.Payload;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON reading and writing for command payloads, event payloads and store documents.
 *
 * <p>{@code Instant} is written as an ISO-8601 string, {@code EntityId} as its
 * plain value, and null fields are omitted so a typed patch turns into exactly
 * the fields it sets.</p>
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public final class PayloadCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> FIELD_MAP = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public PayloadCodec() {
        this(defaultMapper());
    }

    public PayloadCodec(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
    }

    /**
     * Creates the mapper configuration shared by every codec instance.
     *
     * @return a freshly configured ObjectMapper
     */
    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(new EntityIdModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * Serializes a value into a payload.
     *
     * @throws PayloadCodecException if serialization fails
     */
    public Payload encode(Object value) {
        try {
            return Payload.of(mapper.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new PayloadCodecException("Failed to encode payload of type " + typeName(value), e);
        }
    }

    /**
     * Deserializes a payload into the given type.
     *
     * @throws PayloadCodecException if the payload is empty or does not fit the type
     */
    public <T> T decode(Payload payload, Class<T> type) {
        if (payload == null || payload.isEmpty()) {
            throw new PayloadCodecException("Payload is empty, expected " + type.getSimpleName(), null);
        }
        try {
            return mapper.readValue(payload.getValue(), type);
        } catch (JsonProcessingException e) {
            throw new PayloadCodecException("Failed to decode payload as " + type.getSimpleName(), e);
        }
    }

    /**
     * Reads a payload as a JSON tree.
     *
     * @throws PayloadCodecException if the payload is empty or not JSON
     */
    public JsonNode readTree(Payload payload) {
        if (payload == null || payload.isEmpty()) {
            throw new PayloadCodecException("Payload is empty", null);
        }
        try {
            return mapper.readTree(payload.getValue());
        } catch (JsonProcessingException e) {
            throw new PayloadCodecException("Payload is not valid JSON", e);
        }
    }

    /**
     * Converts a JSON subtree into the given type.
     *
     * @throws PayloadCodecException if the node does not fit the type
     */
    public <T> T convert(JsonNode node, Class<T> type) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new PayloadCodecException("Missing value, expected " + type.getSimpleName(), null);
        }
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new PayloadCodecException("Failed to convert value to " + type.getSimpleName(), e);
        }
    }

    /**
     * Converts a stored document (field map) into the given type.
     *
     * @throws PayloadCodecException if the document does not fit the type
     */
    public <T> T fromFields(Map<String, Object> fields, Class<T> type) {
        try {
            return mapper.convertValue(fields, type);
        } catch (IllegalArgumentException e) {
            throw new PayloadCodecException("Failed to map document to " + type.getSimpleName(), e);
        }
    }

    /**
     * Converts a value into a mutable field map, leaving out null fields.
     *
     * @throws PayloadCodecException if the value cannot be represented as an object
     */
    public Map<String, Object> toFields(Object value) {
        try {
            return mapper.convertValue(value, FIELD_MAP);
        } catch (IllegalArgumentException e) {
            throw new PayloadCodecException("Failed to convert " + typeName(value) + " to fields", e);
        }
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
