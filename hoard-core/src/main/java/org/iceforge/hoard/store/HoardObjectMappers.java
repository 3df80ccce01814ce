package org.iceforge.hoard.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Mapper configuration for the on-disk metadata documents and the JSON responses.
 * Property names are snake_case; map keys are written as given.
 */
public final class HoardObjectMappers {
    private HoardObjectMappers() {}

    public static ObjectMapper metadataMapper() {
        return configure(new ObjectMapper());
    }

    /**
     * Applies the metadata settings to an existing mapper (e.g. one owned by Spring).
     */
    public static ObjectMapper configure(ObjectMapper mapper) {
        return mapper
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }
}
