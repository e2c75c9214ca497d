package com.masterplan.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import spark.ResponseTransformer;

/**
 * Shared Jackson configuration. Everything we read or write (draft descriptors, release manifests, job snapshots,
 * API responses) uses snake_case property names, because those documents are consumed by the viewer and UI.
 */
public abstract class JsonUtil {

    public static final ObjectMapper objectMapper = createObjectMapper(false);

    /**
     * Sorted properties and map keys with no whitespace. The bytes produced for a given object graph do not depend
     * on field declaration order or HashMap iteration order, so this is what content checksums are computed over.
     */
    public static final ObjectMapper canonicalObjectMapper = createObjectMapper(true);

    public static final ResponseTransformer toJson = objectMapper::writeValueAsString;

    private static ObjectMapper createObjectMapper (boolean canonical) {
        JsonMapper.Builder builder = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .serializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                // Draft descriptors are hand-written and may carry extra notes for the editors.
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        if (canonical) {
            builder.enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                   .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        }
        return builder.build();
    }

    public static ObjectNode objectNode () {
        return objectMapper.createObjectNode();
    }

    public static String toJsonString (Object object) {
        try {
            return objectMapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize object to JSON.", e);
        }
    }

    /** Represent the supplied object as JSON in a byte array, formatted for human readers. */
    public static byte[] toPrettyJsonBytes (Object object) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(object);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize object to JSON.", e);
        }
    }

    public static byte[] toCanonicalJsonBytes (Object object) {
        try {
            return canonicalObjectMapper.writeValueAsBytes(object);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize object to canonical JSON.", e);
        }
    }

}
