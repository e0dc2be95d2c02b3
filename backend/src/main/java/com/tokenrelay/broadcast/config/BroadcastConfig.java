package com.tokenrelay.broadcast.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tokenrelay.broadcast.BroadcastSettings;
import com.tokenrelay.broadcast.PriceBroadcastServer;
import com.tokenrelay.cache.config.CacheProperties;
import com.tokenrelay.common.TieredCache;
import com.tokenrelay.upstream.PriceFeedSource;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;

/**
 * Price broadcast server with its own last-known-values cache.
 */
@Configuration
@EnableConfigurationProperties(BroadcastProperties.class)
public class BroadcastConfig {

    private static final int MIN_LAST_KNOWN_SIZE = 100;

    @Bean
    public PriceBroadcastServer priceBroadcastServer(PriceFeedSource priceFeedSource, BroadcastProperties properties,
                                                     CacheProperties cacheProperties, ObjectMapper objectMapper,
                                                     Clock clock, TaskScheduler taskScheduler) {
        TieredCache lastKnown = new TieredCache("broadcast-last-known",
                Math.max(MIN_LAST_KNOWN_SIZE, properties.getTrackedIds().size()), properties.getLastKnownTtl(),
                cacheProperties.getHotThreshold(), clock, taskScheduler, cacheProperties.getSweepInterval());
        BroadcastSettings settings = new BroadcastSettings(properties.getTrackedIds(), properties.getPollInterval(),
                properties.getKeepAliveInterval(), properties.getIdleTimeout(), properties.getPollTimeout(),
                properties.getSubscriberBufferSize());
        return new PriceBroadcastServer(priceFeedSource, lastKnown, settings, objectMapper, clock, taskScheduler);
    }
}
