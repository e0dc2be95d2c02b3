package com.tokenrelay.upstream.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

/**
 * Quote API (Jupiter) endpoints and credentials. Documented in application.yml under tokenrelay.quote-api.
 */
@ConfigurationProperties(prefix = "tokenrelay.quote-api")
@NoArgsConstructor
@Getter
@Setter
public class QuoteApiProperties {

    /** Authenticated base URL, used when an API key is configured. */
    private String baseUrl = "https://api.jup.ag";

    /** Keyless base URL, used when no API key is configured. */
    private String publicBaseUrl = "https://lite-api.jup.ag";

    /** Token data API (pools, charts, holders, transactions). */
    private String dataBaseUrl = "https://datapi.jup.ag";

    /** Sent as x-api-key when present. Optional. */
    private String apiKey;

    /**
     * Connect timeout in seconds for the quote API HTTP client.
     */
    private int connectTimeoutSeconds = 5;

    /**
     * Read timeout in seconds for the quote API HTTP client.
     */
    private int readTimeoutSeconds = 10;

    public boolean hasApiKey() {
        return StringUtils.hasText(apiKey);
    }
}
