package com.aero.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties for the Aero gateway.
 */
@Data
@Component
@ConfigurationProperties(prefix = "aero")
public class GatewayProperties {

    /**
     * Provider used when a request names no provider or an unknown one.
     */
    private String defaultProvider = "gemini";

    private Map<String, ProviderConfig> providers = new HashMap<>();
    private CacheConfig cache = new CacheConfig();
    private RateLimitConfig rateLimit = new RateLimitConfig();
    private RetryConfig retry = new RetryConfig();
    private ProxyConfig proxy = new ProxyConfig();

    /**
     * Returns the configuration for a provider id, or an empty (unconfigured) one.
     */
    public ProviderConfig provider(String providerId) {
        ProviderConfig config = providers.get(providerId);
        return config != null ? config : new ProviderConfig();
    }

    @Data
    public static class ProviderConfig {
        private boolean enabled = true;
        private String baseUrl;
        private String apiKey;
        private String model;
        private Double temperature;
        private Integer maxTokens;

        public boolean hasCredential() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    @Data
    public static class CacheConfig {
        private Duration ttl = Duration.ofSeconds(60);

        /**
         * Number of leading characters of the trimmed prompt that form the cache key.
         */
        private int fingerprintLength = 200;
    }

    @Data
    public static class RateLimitConfig {
        private Duration minInterval = Duration.ofSeconds(1);
    }

    @Data
    public static class RetryConfig {

        /**
         * Total attempts, including the first call.
         */
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration jitterBound = Duration.ofMillis(250);
    }

    @Data
    public static class ProxyConfig {
        private Duration timeout = Duration.ofSeconds(60);
    }
}
