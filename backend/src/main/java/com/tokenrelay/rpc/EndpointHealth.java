package com.tokenrelay.rpc;

/**
 * Snapshot of one endpoint for the stats endpoint.
 */
public record EndpointHealth(String url, boolean healthy, long responseTimeMs, int consecutiveErrors, double score) {
}
