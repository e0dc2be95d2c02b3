package com.tokenrelay.cache.config;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Outbound token-bucket budgets per upstream. Rates sit below the published upstream limits to leave headroom.
 */
@ConfigurationProperties(prefix = "tokenrelay.rate-limit")
@NoArgsConstructor
@Getter
@Setter
public class RateLimitProperties {

    /** Quote API plan allows 50 req/s; 45 keeps 5 in reserve. */
    private Budget quoteApi = new Budget(45, 50);

    private Budget rpcNode = new Budget(20, 25);

    @NoArgsConstructor
    @AllArgsConstructor
    @Getter
    @Setter
    public static class Budget {
        private double ratePerSecond;
        private int maxBurst;
    }
}
