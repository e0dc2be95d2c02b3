package com.tokenrelay.cache;

import java.time.Duration;

/**
 * Tuning of {@link CoalescingCacheManager}.
 *
 * @param requestsPerMinuteCeiling upstream fetches allowed per key in any 60s window before the key is served from cache only
 * @param staleRetention           how long a last-known value stays available for stale fallback
 * @param maxBackoff               cap of the per-key backoff after HTTP 429
 * @param stateRetention           idle time after which per-key window and backoff state is dropped
 */
public record CoalescingSettings(int requestsPerMinuteCeiling,
                                 Duration staleRetention,
                                 Duration maxBackoff,
                                 Duration stateRetention) {

    public static CoalescingSettings defaults() {
        return new CoalescingSettings(60, Duration.ofMinutes(5), Duration.ofSeconds(60), Duration.ofMinutes(2));
    }
}
