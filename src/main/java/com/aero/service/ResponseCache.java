package com.aero.service;

import com.aero.config.GatewayProperties;
import com.aero.model.CacheEntry;
import com.aero.model.CacheKey;
import com.aero.model.CacheStatistics;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * TTL-bounded in-memory store of recent provider results, keyed by provider id and
 * prompt fingerprint.
 *
 * <p>Writes race freely (last write wins); values for a key are interchangeable.
 */
@Slf4j
@Service
public class ResponseCache {

    private final Cache<CacheKey, CacheEntry> store;
    private final Ticker ticker;
    private final Duration ttl;
    private final int fingerprintLength;

    public ResponseCache(Cache<CacheKey, CacheEntry> responseStore, Ticker gatewayTicker,
                         GatewayProperties properties) {
        this.store = responseStore;
        this.ticker = gatewayTicker;
        this.ttl = properties.getCache().getTtl();
        this.fingerprintLength = properties.getCache().getFingerprintLength();
    }

    /**
     * Look up a fresh entry.
     *
     * @param providerId requested provider id
     * @param prompt     prompt text
     * @return the entry if present and younger than the TTL; a stale entry is purged
     */
    public Optional<CacheEntry> get(String providerId, String prompt) {
        CacheKey key = keyFor(providerId, prompt);
        CacheEntry entry = store.getIfPresent(key);
        if (entry == null) {
            return Optional.empty();
        }

        if (!entry.isFresh(ticker.read(), ttl)) {
            store.asMap().remove(key, entry);
            log.debug("Purged stale cache entry for provider {}", providerId);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    /**
     * Store or overwrite the result for a provider and prompt.
     */
    public void set(String providerId, String prompt, String text) {
        store.put(keyFor(providerId, prompt), new CacheEntry(text, ticker.read()));
    }

    public Duration age(CacheEntry entry) {
        return entry.age(ticker.read());
    }

    public CacheStatistics stats() {
        store.cleanUp();
        CacheStats stats = store.stats();
        return CacheStatistics.builder()
                .entries(store.estimatedSize())
                .hits(stats.hitCount())
                .misses(stats.missCount())
                .hitRate(stats.hitRate())
                .ttlSeconds(ttl.toSeconds())
                .build();
    }

    public void clear() {
        store.invalidateAll();
        log.info("Response cache cleared");
    }

    /**
     * Provider ids resolve case-insensitively, so the namespace is the lower-cased trimmed id.
     */
    CacheKey keyFor(String providerId, String prompt) {
        String namespace = providerId == null ? "" : providerId.trim().toLowerCase(Locale.ROOT);
        return new CacheKey(namespace, fingerprint(prompt, fingerprintLength));
    }

    /**
     * Trim the prompt and keep at most {@code length} leading characters.
     */
    public static String fingerprint(String prompt, int length) {
        String trimmed = prompt == null ? "" : prompt.trim();
        return trimmed.length() > length ? trimmed.substring(0, length) : trimmed;
    }
}
