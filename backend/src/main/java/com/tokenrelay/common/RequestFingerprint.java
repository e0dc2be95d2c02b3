package com.tokenrelay.common;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Deterministic key for a logical request: method plus canonical JSON of its parameters (map keys sorted),
 * so equal requests coalesce regardless of parameter order.
 */
public final class RequestFingerprint {

    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private RequestFingerprint() {
    }

    public static String of(String method, Object params) {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method is required");
        }
        if (params == null) {
            return method;
        }
        try {
            // JsonNode trees keep insertion order, so go through plain maps first
            Object plain = CANONICAL.convertValue(params, Object.class);
            return method + "|" + CANONICAL.writeValueAsString(plain);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Cannot fingerprint params for " + method, e);
        }
    }
}
