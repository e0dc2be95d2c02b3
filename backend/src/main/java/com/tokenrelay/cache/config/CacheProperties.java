package com.tokenrelay.cache.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Relay cache configuration. Documented in application.yml under tokenrelay.cache.
 */
@ConfigurationProperties(prefix = "tokenrelay.cache")
@NoArgsConstructor
@Getter
@Setter
public class CacheProperties {

    /** Max entries of the shared relay cache; oldest inserted entry is evicted first. */
    private int maxSize = 10_000;

    /** TTL for entries stored without an explicit one. */
    private Duration defaultTtl = Duration.ofSeconds(1);

    /** Reads of a fresh entry before it is promoted to the hot tier. */
    private int hotThreshold = 10;

    /** Interval of the expired-entry sweep. */
    private Duration sweepInterval = Duration.ofSeconds(10);

    /** Upstream fetches allowed per key per minute; beyond this the key is served from cache only. */
    private int requestsPerMinuteCeiling = 60;

    /** How long a last-known value remains available for stale fallback. */
    private Duration staleRetention = Duration.ofMinutes(5);

    /** Cap of the per-key backoff after upstream HTTP 429. */
    private Duration maxBackoff = Duration.ofSeconds(60);

    /** Idle time after which per-key request window and backoff state is evicted. */
    private Duration stateRetention = Duration.ofMinutes(2);

    private Ttl ttl = new Ttl();

    /**
     * TTL per data category.
     */
    @NoArgsConstructor
    @Getter
    @Setter
    public static class Ttl {
        private Duration price = Duration.ofSeconds(1);
        private Duration quote = Duration.ofSeconds(2);
        /** GET responses of the quote API proxy. */
        private Duration proxy = Duration.ofSeconds(1);
        private Duration tokenInfo = Duration.ofSeconds(5);
        private Duration chart = Duration.ofSeconds(10);
        private Duration holders = Duration.ofSeconds(30);
        private Duration transactions = Duration.ofSeconds(15);
        /** RPC relay results (balances, account info). */
        private Duration rpc = Duration.ofSeconds(2);
        /** getSlot changes every ~400ms. */
        private Duration slot = Duration.ofMillis(400);
    }
}
