package com.aero.service;

import com.aero.model.CacheEntry;
import com.aero.model.CacheStatistics;
import com.aero.model.GatewayData;
import com.aero.model.GatewayErrorKind;
import com.aero.model.GatewayRequest;
import com.aero.model.GatewayResult;
import com.aero.model.ProviderReply;
import com.aero.model.StreamUpdate;
import com.aero.provider.ProviderConfigurationException;
import com.aero.provider.ProviderException;
import com.aero.provider.ProviderResponseException;
import com.aero.provider.RetryExhaustedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Main gateway service that orchestrates cache lookup and provider forwarding.
 *
 * <p>Provider-side failures never reach the caller as errors: they are turned into a
 * degraded result carrying a readable summary and the failure kind. Only successful
 * results are cached.
 */
@Slf4j
@Service
public class GatewayService {

    public static final String RATE_LIMIT_APOLOGY =
            "The AI service is receiving too many requests right now. Please wait a moment and try again.";

    static final String PROVIDER_FAILURE_SUMMARY =
            "The AI service could not complete this request. Please try again later.";

    private final ResponseCache responseCache;
    private final ProviderRegistry providerRegistry;

    public GatewayService(ResponseCache responseCache, ProviderRegistry providerRegistry) {
        this.responseCache = responseCache;
        this.providerRegistry = providerRegistry;
    }

    /**
     * Generate a summary for a prompt.
     * Checks the cache first, then forwards to the resolved provider.
     */
    public Mono<GatewayResult> generate(GatewayRequest request) {
        return Mono.defer(() -> {
            ProviderRegistry.ResolvedProvider resolved = providerRegistry.resolve(request.getProviderId());
            String providerId = resolved.getRequestedId();
            String prompt = request.getPrompt();

            Optional<CacheEntry> cached = responseCache.get(providerId, prompt);
            if (cached.isPresent()) {
                log.info("Serving cached response for provider {}", providerId);
                return Mono.just(GatewayResult.success(cachedData(providerId, cached.get())));
            }

            // Cache miss - forward to provider
            log.info("Cache miss - forwarding to provider {} via {}",
                    providerId, resolved.getStrategy().getKind().getId());
            return resolved.getStrategy().call(prompt)
                    .map(reply -> {
                        responseCache.set(providerId, prompt, reply.getSummary());
                        return GatewayResult.success(replyData(providerId, reply));
                    })
                    .onErrorResume(error -> Mono.just(degrade(providerId, error)));
        });
    }

    /**
     * Generate a summary as a stream of updates: {@code start}, deltas, then {@code done}
     * with the final summary and its provenance. Streamed replies omit {@code raw} and
     * {@code attempts}.
     */
    public Flux<StreamUpdate> stream(GatewayRequest request) {
        return Flux.defer(() -> {
            ProviderRegistry.ResolvedProvider resolved = providerRegistry.resolve(request.getProviderId());
            String providerId = resolved.getRequestedId();
            String prompt = request.getPrompt();

            Optional<CacheEntry> cached = responseCache.get(providerId, prompt);
            if (cached.isPresent()) {
                log.info("Replaying cached response for provider {} as a stream", providerId);
                CacheEntry entry = cached.get();
                return Flux.concat(
                        Mono.just(StreamUpdate.start(providerId, true)),
                        Flux.fromIterable(TextChunker.split(entry.getText())).map(StreamUpdate::delta),
                        Mono.fromSupplier(() -> StreamUpdate.done(GatewayResult.success(cachedData(providerId, entry)))));
            }

            log.info("Cache miss - streaming from provider {} via {}",
                    providerId, resolved.getStrategy().getKind().getId());
            StringBuilder accumulated = new StringBuilder();

            Flux<StreamUpdate> deltas = resolved.getStrategy().stream(prompt)
                    .doOnNext(accumulated::append)
                    .map(StreamUpdate::delta);

            Mono<StreamUpdate> done = Mono.fromSupplier(() -> {
                String text = accumulated.toString().trim();
                if (text.isEmpty()) {
                    throw new ProviderResponseException(resolved.getStrategy().getKind().getId(), (Integer) null,
                            "Provider stream ended without text");
                }
                responseCache.set(providerId, prompt, text);
                return StreamUpdate.done(GatewayResult.success(GatewayData.builder()
                        .summary(text)
                        .provider(providerId)
                        .cached(false)
                        .servedBy(resolved.getStrategy().getKind().getId())
                        .build()));
            });

            return Flux.concat(
                    Mono.just(StreamUpdate.start(providerId, false)),
                    deltas.concatWith(done)
                            .onErrorResume(error -> Mono.just(StreamUpdate.done(degrade(providerId, error)))));
        });
    }

    /**
     * Clear the cache.
     */
    public void clearCache() {
        responseCache.clear();
    }

    /**
     * Get cache statistics.
     */
    public CacheStatistics getCacheStats() {
        return responseCache.stats();
    }

    private GatewayData cachedData(String providerId, CacheEntry entry) {
        return GatewayData.builder()
                .summary(entry.getText())
                .provider(providerId)
                .cached(true)
                .cacheAgeSeconds(responseCache.age(entry).toSeconds())
                .build();
    }

    private GatewayData replyData(String providerId, ProviderReply reply) {
        return GatewayData.builder()
                .summary(reply.getSummary())
                .provider(providerId)
                .raw(reply.getRaw())
                .cached(false)
                .attempts(reply.getAttempts())
                .servedBy(reply.getServedBy() != null ? reply.getServedBy().getId() : null)
                .build();
    }

    /**
     * Map a provider failure to a degraded result.
     */
    GatewayResult degrade(String providerId, Throwable error) {
        GatewayData.GatewayDataBuilder data = GatewayData.builder()
                .provider(providerId)
                .cached(false);

        if (error instanceof RetryExhaustedException) {
            RetryExhaustedException exhausted = (RetryExhaustedException) error;
            log.warn("Provider {} still rate limited after {} attempts, serving apology",
                    providerId, exhausted.getAttempts());
            return GatewayResult.degraded(
                    data.summary(RATE_LIMIT_APOLOGY).attempts(exhausted.getAttempts()).build(),
                    GatewayErrorKind.RATE_LIMITED);
        }

        if (error instanceof ProviderConfigurationException) {
            log.warn("Provider {} is not usable: {}", providerId, error.getMessage());
            return GatewayResult.degraded(
                    data.summary("The selected AI provider is not configured on this server. " + error.getMessage())
                            .build(),
                    GatewayErrorKind.CONFIGURATION);
        }

        if (error instanceof ProviderException) {
            log.warn("Provider {} failed: {}", providerId, error.getMessage());
            return GatewayResult.degraded(
                    data.summary(PROVIDER_FAILURE_SUMMARY).build(),
                    ((ProviderException) error).getKind());
        }

        log.error("Unexpected failure calling provider {}", providerId, error);
        return GatewayResult.degraded(
                data.summary(PROVIDER_FAILURE_SUMMARY).build(),
                GatewayErrorKind.PROVIDER_FAILURE);
    }
}
