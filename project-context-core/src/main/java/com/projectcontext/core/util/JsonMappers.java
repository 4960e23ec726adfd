package com.projectcontext.core.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson mapper configuration.
 *
 * <p>{@code Instant} values are written as ISO-8601 strings. The strict JSON mapper
 * fails on unknown properties and is used for persisted state whose fields carry
 * invariants; the lenient YAML mapper is used for user-edited configuration.
 */
public final class JsonMappers {

    private JsonMappers() {
        // Utility class
    }

    /**
     * Creates a JSON mapper that rejects unknown properties.
     *
     * @return new strict mapper
     */
    public static ObjectMapper strictJson() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    }

    /**
     * Creates a YAML mapper for configuration files.
     *
     * @return new YAML mapper
     */
    public static ObjectMapper yaml() {
        return new ObjectMapper(new YAMLFactory())
            .registerModule(new JavaTimeModule())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
