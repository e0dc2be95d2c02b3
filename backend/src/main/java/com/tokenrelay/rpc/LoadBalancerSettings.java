package com.tokenrelay.rpc;

import java.time.Duration;

/**
 * Tuning of {@link RpcLoadBalancer}.
 *
 * @param errorThreshold consecutive errors tolerated before an endpoint is marked unhealthy
 * @param maxAttempts    endpoints tried per call before giving up
 * @param probeInterval  delay between health probe rounds
 * @param probeTimeout   timeout of a single probe
 */
public record LoadBalancerSettings(int errorThreshold, int maxAttempts, Duration probeInterval, Duration probeTimeout) {

    public LoadBalancerSettings {
        if (errorThreshold < 0) {
            throw new IllegalArgumentException("errorThreshold must be >= 0");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
    }

    public static LoadBalancerSettings defaults() {
        return new LoadBalancerSettings(5, 3, Duration.ofSeconds(5), Duration.ofSeconds(3));
    }
}
