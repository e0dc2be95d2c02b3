package com.tokenrelay.common;

/**
 * Sizes of the two tiers of a {@link TieredCache}.
 */
public record CacheStats(String name, int hotSize, int standardSize, int totalSize, int maxSize) {
}
