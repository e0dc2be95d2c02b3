package com.tokenrelay.cache.config;

import com.tokenrelay.cache.CoalescingCacheManager;
import com.tokenrelay.cache.CoalescingSettings;
import com.tokenrelay.common.TieredCache;
import com.tokenrelay.common.TokenBucketRateLimiter;
import com.tokenrelay.common.Upstream;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.util.Map;

/**
 * Single construction point of the shared relay cache, the per-upstream rate limiters and the cache manager.
 * Spring closes the cache and limiters on shutdown, cancelling their scheduled tasks.
 */
@Configuration
@EnableConfigurationProperties({ CacheProperties.class, RateLimitProperties.class })
public class CacheConfig {

    @Bean
    public TieredCache relayCache(CacheProperties properties, Clock clock, TaskScheduler taskScheduler) {
        return new TieredCache("relay", properties.getMaxSize(), properties.getDefaultTtl(),
                properties.getHotThreshold(), clock, taskScheduler, properties.getSweepInterval());
    }

    @Bean
    public TokenBucketRateLimiter quoteApiRateLimiter(RateLimitProperties properties, Clock clock, TaskScheduler taskScheduler) {
        RateLimitProperties.Budget budget = properties.getQuoteApi();
        return new TokenBucketRateLimiter(Upstream.QUOTE_API.id(), budget.getRatePerSecond(), budget.getMaxBurst(),
                clock, taskScheduler);
    }

    @Bean
    public TokenBucketRateLimiter rpcNodeRateLimiter(RateLimitProperties properties, Clock clock, TaskScheduler taskScheduler) {
        RateLimitProperties.Budget budget = properties.getRpcNode();
        return new TokenBucketRateLimiter(Upstream.RPC_NODE.id(), budget.getRatePerSecond(), budget.getMaxBurst(),
                clock, taskScheduler);
    }

    @Bean
    public CoalescingCacheManager coalescingCacheManager(TieredCache relayCache,
                                                         @Qualifier("quoteApiRateLimiter") TokenBucketRateLimiter quoteApiRateLimiter,
                                                         @Qualifier("rpcNodeRateLimiter") TokenBucketRateLimiter rpcNodeRateLimiter,
                                                         CacheProperties properties,
                                                         Clock clock) {
        CoalescingSettings settings = new CoalescingSettings(
                properties.getRequestsPerMinuteCeiling(),
                properties.getStaleRetention(),
                properties.getMaxBackoff(),
                properties.getStateRetention());
        return new CoalescingCacheManager(relayCache,
                Map.of(Upstream.QUOTE_API, quoteApiRateLimiter, Upstream.RPC_NODE, rpcNodeRateLimiter),
                settings, clock);
    }
}
