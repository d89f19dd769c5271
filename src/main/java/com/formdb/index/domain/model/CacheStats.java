package com.formdb.index.domain.model;

import java.time.Duration;

/**
 * Query cache occupancy and performance counters
 */
public record CacheStats(
        int size,
        int capacity,
        Duration ttl,
        long hits,
        long misses,
        long evictions,
        long expirations,
        long invalidations
) {
    public double hitRatio() {
        long total = hits + misses;
        return total > 0 ? (double) hits / total : 0.0;
    }

    public String summary() {
        return String.format("Size: %d/%d, TTL: %ds, Hit ratio: %.1f%%",
                size, capacity, ttl.toSeconds(), hitRatio() * 100);
    }
}
