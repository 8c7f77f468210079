package com.aero.service;

import com.aero.config.GatewayProperties;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Spaces outbound calls to each protected resource by at least a minimum interval.
 *
 * <p>A caller is granted as soon as the interval since the resource's last grant has
 * elapsed; otherwise it sleeps for the remainder without blocking a thread and checks again.
 * Only grants are recorded, so a waiter that cancels leaves nothing behind.
 * Resources are limited independently.
 */
@Slf4j
@Component
public class RateLimiter {

    private final long minIntervalNanos;
    private final Ticker ticker;
    private final ConcurrentMap<String, Lane> lanes = new ConcurrentHashMap<>();

    @Autowired
    public RateLimiter(GatewayProperties properties, Ticker gatewayTicker) {
        this(properties.getRateLimit().getMinInterval(), gatewayTicker);
    }

    public RateLimiter(Duration minInterval, Ticker ticker) {
        this.minIntervalNanos = Math.max(0, minInterval.toNanos());
        this.ticker = ticker;
    }

    /**
     * Wait for the resource's next slot.
     *
     * @param resourceId protected resource, typically a provider id
     * @return the granted ticker timestamp (nanoseconds), the new spacing baseline
     */
    public Mono<Long> acquire(String resourceId) {
        return Mono.defer(() -> awaitGrant(resourceId, lanes.computeIfAbsent(resourceId, id -> new Lane())));
    }

    private Mono<Long> awaitGrant(String resourceId, Lane lane) {
        return Mono.defer(() -> {
            long now = ticker.read();
            long remaining = lane.tryGrant(now, minIntervalNanos);
            if (remaining <= 0) {
                return Mono.just(now);
            }
            log.debug("Rate limiter holding call to {} for {} ms", resourceId, remaining / 1_000_000);
            return Mono.delay(Duration.ofNanos(remaining)).then(awaitGrant(resourceId, lane));
        });
    }

    /**
     * Last grant of one resource. The monitor is held only to compare and record, never across a wait.
     */
    private static final class Lane {

        private boolean granted;
        private long lastGrant;

        synchronized long tryGrant(long now, long interval) {
            if (granted && now - lastGrant < interval) {
                return interval - (now - lastGrant);
            }
            lastGrant = now;
            granted = true;
            return 0;
        }
    }
}
