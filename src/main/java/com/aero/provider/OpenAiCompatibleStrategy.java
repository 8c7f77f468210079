package com.aero.provider;

import com.aero.config.GatewayProperties;
import com.aero.model.ProviderReply;
import com.aero.service.RateLimiter;
import com.aero.service.RetryExecutor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Objects;

/**
 * Strategy for providers speaking the OpenAI chat completions protocol
 * (OpenAI, DeepSeek, Groq and the Perplexity search endpoint).
 */
@Slf4j
public class OpenAiCompatibleStrategy extends AbstractProviderStrategy {

    private static final String DONE_MARKER = "[DONE]";
    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
            new ParameterizedTypeReference<>() {
            };

    private final WebClient webClient;

    public OpenAiCompatibleStrategy(
            ProviderKind kind,
            GatewayProperties.ProviderConfig config,
            WebClient webClient,
            ObjectMapper objectMapper,
            RateLimiter rateLimiter,
            RetryExecutor retryExecutor) {
        super(kind, config, objectMapper, rateLimiter, retryExecutor);
        this.webClient = webClient;
    }

    @Override
    protected Mono<ProviderReply> exchange(String prompt) {
        log.info("Forwarding request to {}: model={}", kind.getId(), model());

        return webClient.post()
                .uri(baseUrl() + "/chat/completions")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(buildPayload(prompt, false))
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::classifyError)
                .bodyToMono(JsonNode.class)
                .map(response -> ProviderReply.builder()
                        .summary(requireText(
                                response.path("choices").path(0).path("message").path("content").asText(null),
                                "choices[0].message.content"))
                        .raw(response)
                        .build());
    }

    @Override
    protected Flux<String> streamExchange(String prompt) {
        log.info("Streaming request to {}: model={}", kind.getId(), model());

        return webClient.post()
                .uri(baseUrl() + "/chat/completions")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(buildPayload(prompt, true))
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::classifyError)
                .bodyToFlux(SSE_TYPE)
                .map(ServerSentEvent::data)
                .filter(Objects::nonNull)
                .map(String::trim)
                .takeWhile(data -> !DONE_MARKER.equals(data))
                .filter(data -> !data.isEmpty())
                .map(this::extractDelta)
                .filter(delta -> !delta.isEmpty());
    }

    private ObjectNode buildPayload(String prompt, boolean stream) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", model());

        ArrayNode messages = payload.putArray("messages");
        ObjectNode userMessage = messages.addObject();
        userMessage.put("role", "user");
        userMessage.put("content", prompt);

        if (config.getTemperature() != null) {
            payload.put("temperature", config.getTemperature());
        }
        if (config.getMaxTokens() != null) {
            payload.put("max_tokens", config.getMaxTokens());
        }
        if (stream) {
            payload.put("stream", true);
        }
        return payload;
    }

    private String extractDelta(String data) {
        try {
            return objectMapper.readTree(data)
                    .path("choices").path(0).path("delta").path("content")
                    .asText("");
        } catch (JsonProcessingException e) {
            throw new ProviderResponseException(kind.getId(),
                    "Provider " + kind.getId() + " sent an unreadable stream event", e);
        }
    }
}
