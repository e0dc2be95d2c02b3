package com.tokenrelay.upstream;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Proxied upstream payload and whether it was served from a fresh cache entry.
 */
public record ProxyResult(JsonNode body, boolean cacheHit) {
}
