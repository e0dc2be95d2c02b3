package com.tokenrelay.common;

/**
 * Snapshot of a {@link TokenBucketRateLimiter}: queued requests, whole tokens left, shared in-flight requests.
 */
public record RateLimiterStatus(String name,
                                int queueLength,
                                int tokensAvailable,
                                int maxBurst,
                                double ratePerSecond,
                                int pendingDeduped) {
}
