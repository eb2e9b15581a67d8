package com.github.dimitryivaniuta.callpipeline.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Compact JSON with map keys sorted at every depth. Used as hash input, so two
 * structurally equal values always produce the same text.
 */
public class CanonicalJson {

    private final ObjectMapper mapper;
    private final ObjectMapper canonical;

    public CanonicalJson(ObjectMapper mapper) {
        this.mapper = mapper;
        this.canonical = mapper.copy()
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .disable(SerializationFeature.INDENT_OUTPUT);
    }

    public String write(Object value) {
        // JsonNode trees keep insertion order, so flatten to plain maps first
        Object plain = (value == null) ? null : mapper.convertValue(value, Object.class);
        try {
            return canonical.writeValueAsString(plain);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not serializable to JSON", e);
        }
    }
}
