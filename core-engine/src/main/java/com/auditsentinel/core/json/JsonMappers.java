package com.auditsentinel.core.json;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Factory for the {@link ObjectMapper} configuration shared by the result
 * store, model loading and the detection server.
 *
 * <p>
 * Dates are written as ISO-8601 strings and unknown input properties are
 * ignored, so older clients and newer JSON-lines files stay readable.
 * </p>
 *
 * @since 1.0.0
 */
public final class JsonMappers {

    private JsonMappers() {
        // utility class, not instantiable
    }

    /**
     * @return a new, fully configured mapper; callers may cache it
     */
    public static ObjectMapper create() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }
}
