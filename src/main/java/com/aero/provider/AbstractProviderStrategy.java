package com.aero.provider;

import com.aero.config.GatewayProperties;
import com.aero.model.ProviderReply;
import com.aero.service.RateLimiter;
import com.aero.service.RetryExecutor;
import com.aero.service.TextChunker;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.ClientResponse;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Abstract base class for provider strategies with common functionality.
 *
 * <p>Every outbound attempt first acquires the provider's rate limiter slot; the whole
 * attempt sequence runs inside the retry executor. Subclasses only implement the raw
 * exchange.
 */
@Slf4j
public abstract class AbstractProviderStrategy implements ProviderStrategy {

    private static final int ERROR_BODY_PREVIEW = 300;

    protected final ProviderKind kind;
    protected final GatewayProperties.ProviderConfig config;
    protected final ObjectMapper objectMapper;
    private final RateLimiter rateLimiter;
    private final RetryExecutor retryExecutor;

    protected AbstractProviderStrategy(
            ProviderKind kind,
            GatewayProperties.ProviderConfig config,
            ObjectMapper objectMapper,
            RateLimiter rateLimiter,
            RetryExecutor retryExecutor) {
        this.kind = kind;
        this.config = config;
        this.objectMapper = objectMapper;
        this.rateLimiter = rateLimiter;
        this.retryExecutor = retryExecutor;
    }

    @Override
    public ProviderKind getKind() {
        return kind;
    }

    @Override
    public boolean isAvailable() {
        return config.isEnabled() && config.hasCredential();
    }

    @Override
    public Mono<ProviderReply> call(String prompt) {
        return Mono.defer(() -> {
            ProviderConfigurationException misconfigured = checkConfiguration();
            if (misconfigured != null) {
                return Mono.error(misconfigured);
            }

            AtomicInteger attempts = new AtomicInteger();
            Mono<ProviderReply> attempt = Mono.defer(() -> {
                attempts.incrementAndGet();
                return rateLimiter.acquire(kind.getId())
                        .then(Mono.defer(() -> exchange(prompt)));
            });

            return retryExecutor.execute(kind.getId(), attempt)
                    .map(reply -> reply.toBuilder()
                            .servedBy(kind)
                            .attempts(attempts.get())
                            .build())
                    .doOnSuccess(reply -> log.debug("Provider {} answered after {} attempt(s)",
                            kind.getId(), attempts.get()));
        });
    }

    @Override
    public Flux<String> stream(String prompt) {
        return Flux.defer(() -> {
            ProviderConfigurationException misconfigured = checkConfiguration();
            if (misconfigured != null) {
                return Flux.error(misconfigured);
            }

            Flux<String> attempt = rateLimiter.acquire(kind.getId())
                    .thenMany(Flux.defer(() -> streamExchange(prompt)));

            return retryExecutor.execute(kind.getId(), attempt);
        });
    }

    /**
     * Issue one outbound request and extract the summary.
     */
    protected abstract Mono<ProviderReply> exchange(String prompt);

    /**
     * Issue one outbound streaming request. Providers without native streaming
     * split the finished summary into word-boundary chunks.
     */
    protected Flux<String> streamExchange(String prompt) {
        return exchange(prompt)
                .flatMapIterable(reply -> TextChunker.split(reply.getSummary()));
    }

    protected String baseUrl() {
        String baseUrl = config.getBaseUrl() != null && !config.getBaseUrl().isBlank()
                ? config.getBaseUrl()
                : kind.getDefaultBaseUrl();
        return baseUrl.replaceAll("/+$", "");
    }

    protected String model() {
        return config.getModel() != null && !config.getModel().isBlank()
                ? config.getModel()
                : kind.getDefaultModel();
    }

    /**
     * Map an error response to a classified exception. HTTP 429 is the sole
     * trigger for {@link RateLimitedException}.
     */
    protected Mono<ProviderException> classifyError(ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> {
                    if (status == 429) {
                        log.warn("Provider {} throttled the request (429)", kind.getId());
                        return new RateLimitedException(kind.getId(),
                                "Provider " + kind.getId() + " rate limited: " + describeError(body));
                    }
                    return new ProviderResponseException(kind.getId(), status,
                            "Provider " + kind.getId() + " request failed (" + status + "): " + describeError(body));
                });
    }

    /**
     * Reject a reply that carries no text.
     */
    protected String requireText(String text, String shape) {
        if (text == null || text.isBlank()) {
            throw new ProviderResponseException(kind.getId(), (Integer) null,
                    "Provider " + kind.getId() + " returned no text at " + shape);
        }
        return text.trim();
    }

    private ProviderConfigurationException checkConfiguration() {
        if (!config.isEnabled()) {
            return new ProviderConfigurationException(kind.getId(),
                    "Provider " + kind.getId() + " is disabled");
        }
        if (!config.hasCredential()) {
            return new ProviderConfigurationException(kind.getId(),
                    "Missing credential for provider " + kind.getId() + " (" + kind.getCredentialEnv() + ")");
        }
        return null;
    }

    /**
     * Pull {@code error.message} (or {@code message}) from a provider error body.
     */
    private String describeError(String body) {
        if (body.isBlank()) {
            return "empty response body";
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode message = root.path("error").path("message");
            if (message.isTextual()) {
                return message.asText();
            }
            if (root.path("message").isTextual()) {
                return root.path("message").asText();
            }
        } catch (Exception e) {
            log.debug("Provider {} error body is not JSON", kind.getId());
        }
        return body.length() > ERROR_BODY_PREVIEW ? body.substring(0, ERROR_BODY_PREVIEW) + "..." : body;
    }
}
