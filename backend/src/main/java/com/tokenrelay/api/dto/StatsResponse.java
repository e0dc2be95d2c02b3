package com.tokenrelay.api.dto;

import com.tokenrelay.cache.CacheManagerStats;
import com.tokenrelay.rpc.LoadBalancerStats;

import java.time.Instant;

/**
 * GET /api/stats: cache manager (including both rate limiters), RPC endpoint health, stream subscribers.
 */
public record StatsResponse(CacheManagerStats cacheManager, LoadBalancerStats loadBalancer, int streamSubscribers,
                            Instant timestamp) {
}
