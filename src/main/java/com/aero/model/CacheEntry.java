package com.aero.model;

import lombok.Value;

import java.time.Duration;

/**
 * Cached result text with its monotonic insertion time.
 */
@Value
public class CacheEntry {

    String text;

    /**
     * Ticker reading (nanoseconds) at insertion.
     */
    long insertedAtNanos;

    public Duration age(long nowNanos) {
        return Duration.ofNanos(Math.max(0, nowNanos - insertedAtNanos));
    }

    public boolean isFresh(long nowNanos, Duration ttl) {
        return nowNanos - insertedAtNanos < ttl.toNanos();
    }
}
