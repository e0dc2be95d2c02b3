package com.tokenrelay.api.dto;

import java.time.Instant;

/**
 * Standard error response body: error (code), details (message or upstream payload), timestamp (ISO 8601).
 */
public record ErrorBody(String error, Object details, Instant timestamp) {

    /**
     * Creates an error body with timestamp set to now (UTC).
     */
    public static ErrorBody of(String error, Object details) {
        return new ErrorBody(error, details, Instant.now());
    }
}
