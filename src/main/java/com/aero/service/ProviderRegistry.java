package com.aero.service;

import com.aero.config.GatewayProperties;
import com.aero.provider.ProviderKind;
import com.aero.provider.ProviderStrategy;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves a requested provider id to the strategy that serves it.
 *
 * <p>Resolution is lenient: a missing or unknown id selects the default provider, and a
 * provider that declares a fallback is swapped for the default when it has no credential.
 */
@Slf4j
@Service
public class ProviderRegistry {

    private final Map<ProviderKind, ProviderStrategy> strategies = new EnumMap<>(ProviderKind.class);
    private final ProviderKind defaultKind;

    public ProviderRegistry(List<ProviderStrategy> strategyList, GatewayProperties properties) {
        for (ProviderStrategy strategy : strategyList) {
            ProviderStrategy previous = strategies.put(strategy.getKind(), strategy);
            if (previous != null) {
                throw new IllegalStateException("Duplicate strategy for provider " + strategy.getKind().getId());
            }
        }

        this.defaultKind = ProviderKind.fromId(properties.getDefaultProvider())
                .orElseGet(() -> {
                    log.warn("Unknown default provider '{}', using {}",
                            properties.getDefaultProvider(), ProviderKind.GEMINI.getId());
                    return ProviderKind.GEMINI;
                });

        if (!strategies.containsKey(defaultKind)) {
            throw new IllegalStateException("No strategy registered for default provider " + defaultKind.getId());
        }

        log.info("Registered {} provider strategies, default provider: {}", strategies.size(), defaultKind.getId());
    }

    /**
     * Resolve a provider id.
     *
     * @param providerId requested id, possibly null, blank or unknown
     * @return requested id (or the default id when absent) with the strategy to call
     */
    public ResolvedProvider resolve(String providerId) {
        boolean absent = providerId == null || providerId.isBlank();
        ProviderKind kind = ProviderKind.fromId(providerId)
                .filter(strategies::containsKey)
                .orElse(defaultKind);

        if (!absent && ProviderKind.fromId(providerId).isEmpty()) {
            log.debug("Unrecognized provider '{}', routing to default {}", providerId, defaultKind.getId());
        }

        ProviderStrategy strategy = strategies.get(kind);
        if (kind.fallsBackToDefault() && kind != defaultKind && !strategy.isAvailable()) {
            log.info("Provider {} is unavailable, routing to default {}", kind.getId(), defaultKind.getId());
            strategy = strategies.get(defaultKind);
        }

        String requestedId = absent ? defaultKind.getId() : providerId.trim();
        return new ResolvedProvider(requestedId, strategy);
    }

    public String getDefaultProviderId() {
        return defaultKind.getId();
    }

    /**
     * Availability of each registered provider, keyed by id.
     */
    public Map<String, Boolean> availability() {
        Map<String, Boolean> availability = new LinkedHashMap<>();
        strategies.forEach((kind, strategy) -> availability.put(kind.getId(), strategy.isAvailable()));
        return Collections.unmodifiableMap(availability);
    }

    @Value
    public static class ResolvedProvider {
        /**
         * Id as the caller asked for it; keys the cache and is echoed back.
         */
        String requestedId;
        ProviderStrategy strategy;
    }
}
