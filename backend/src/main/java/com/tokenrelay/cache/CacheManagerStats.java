package com.tokenrelay.cache;

import com.tokenrelay.common.CacheStats;
import com.tokenrelay.common.RateLimiterStatus;

import java.util.Map;
import java.util.Set;

/**
 * Snapshot of {@link CoalescingCacheManager}: cache tiers, in-flight fetches, keys in backoff, per-key request
 * counts over the last minute and the status of each upstream's rate limiter.
 */
public record CacheManagerStats(CacheStats cache,
                                int pendingFetches,
                                Set<String> backoffKeys,
                                Map<String, Integer> requestCounts,
                                Map<String, RateLimiterStatus> rateLimiters) {
}
