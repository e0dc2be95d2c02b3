package com.tokenrelay.rpc;

import lombok.Getter;

/**
 * One RPC node and its health state. Mutated only by {@link RpcLoadBalancer} under its lock.
 */
@Getter
public class RpcEndpoint {

    public static final int DEFAULT_WEIGHT = 10;

    private final String url;
    private final int weight;
    private boolean healthy = true;
    private int consecutiveErrors;
    private long responseTimeMs;
    /** Epoch millis of the last successful probe; 0 when never probed. */
    private long lastProbe;

    public RpcEndpoint(String url, int weight) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Endpoint url required");
        }
        this.url = url;
        this.weight = weight > 0 ? weight : DEFAULT_WEIGHT;
    }

    public RpcEndpoint(String url) {
        this(url, DEFAULT_WEIGHT);
    }

    void recordSuccess(long elapsedMs) {
        responseTimeMs = elapsedMs;
        consecutiveErrors = Math.max(0, consecutiveErrors - 1);
    }

    void recordProbeSuccess(long elapsedMs, long now) {
        recordSuccess(elapsedMs);
        lastProbe = now;
        healthy = true;
    }

    /**
     * @return true when this failure flipped the endpoint to unhealthy
     */
    boolean recordFailure(int errorThreshold) {
        consecutiveErrors++;
        if (healthy && consecutiveErrors > errorThreshold) {
            healthy = false;
            return true;
        }
        return false;
    }

    void resetErrors() {
        consecutiveErrors = 0;
    }
}
