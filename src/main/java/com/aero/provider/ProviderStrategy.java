package com.aero.provider;

import com.aero.model.ProviderReply;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Call strategy for one provider kind.
 * Implementations handle provider-specific authentication, payload shape and
 * response extraction; throttling and retry are applied around every outbound attempt.
 */
public interface ProviderStrategy {

    /**
     * Provider kind this strategy is bound to.
     *
     * @return provider kind
     */
    ProviderKind getKind();

    /**
     * Check if the provider is enabled and has a credential.
     *
     * @return true if a call can be attempted
     */
    boolean isAvailable();

    /**
     * Generate text for a prompt.
     *
     * @param prompt prompt text
     * @return normalized reply; errors are {@link ProviderException} subtypes where classified
     */
    Mono<ProviderReply> call(String prompt);

    /**
     * Generate text for a prompt as ordered increments.
     *
     * @param prompt prompt text
     * @return text increments whose concatenation is the full summary
     */
    Flux<String> stream(String prompt);
}
