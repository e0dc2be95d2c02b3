package com.tokenrelay.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Retry policy for transient upstream network failures (exponential backoff ± jitter). Documented in application.yml.
 */
@ConfigurationProperties(prefix = "tokenrelay.retry")
@NoArgsConstructor
@Getter
@Setter
public class RetryProperties {

    /** Base delay in ms for first retry; doubles each attempt. Default 250. */
    private long baseDelayMs = 250L;

    /** Jitter factor 0..1 (e.g. 0.2 = ±20%). Default 0.2. */
    private double jitterFactor = 0.2;

    /** Max retry attempts (excluding initial call). Default 2. */
    private int maxAttempts = 2;
}
