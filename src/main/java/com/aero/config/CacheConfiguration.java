package com.aero.config;

import com.aero.model.CacheEntry;
import com.aero.model.CacheKey;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Cache and clock configuration.
 *
 * <p>The {@link Ticker} is the single monotonic time source for the response cache
 * and the rate limiter, so both can be driven by a fake ticker in tests.
 */
@Configuration
public class CacheConfiguration {

    private final GatewayProperties properties;

    public CacheConfiguration(GatewayProperties properties) {
        this.properties = properties;
    }

    @Bean
    public Ticker gatewayTicker() {
        return Ticker.systemTicker();
    }

    @Bean
    public Cache<CacheKey, CacheEntry> responseStore(Ticker gatewayTicker) {
        return caffeineCacheBuilder(properties.getCache(), gatewayTicker).build();
    }

    /**
     * Unbounded by size: entries only leave through TTL expiry or an explicit clear.
     */
    public static Caffeine<Object, Object> caffeineCacheBuilder(GatewayProperties.CacheConfig cache,
                                                                Ticker ticker) {
        return Caffeine.newBuilder()
                .expireAfterWrite(cache.getTtl())
                .ticker(ticker)
                .recordStats();
    }
}
