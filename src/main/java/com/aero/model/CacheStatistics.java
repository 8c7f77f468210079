package com.aero.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response cache statistics for the cache admin endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {

    /**
     * Entries currently held (approximate).
     */
    private long entries;

    private long hits;

    private long misses;

    /**
     * Hit rate (0.0-1.0); 1.0 when there were no lookups yet.
     */
    private double hitRate;

    private long ttlSeconds;
}
