package com.aero.provider;

import com.aero.config.GatewayProperties;
import com.aero.model.ProviderReply;
import com.aero.service.RateLimiter;
import com.aero.service.RetryExecutor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Anthropic (Claude) messages API strategy.
 */
@Slf4j
public class AnthropicStrategy extends AbstractProviderStrategy {

    private static final String ANTHROPIC_VERSION = "2023-06-01";
    private static final int DEFAULT_MAX_TOKENS = 1024;

    private final WebClient webClient;

    public AnthropicStrategy(
            GatewayProperties.ProviderConfig config,
            WebClient webClient,
            ObjectMapper objectMapper,
            RateLimiter rateLimiter,
            RetryExecutor retryExecutor) {
        super(ProviderKind.ANTHROPIC, config, objectMapper, rateLimiter, retryExecutor);
        this.webClient = webClient;
    }

    @Override
    protected Mono<ProviderReply> exchange(String prompt) {
        log.info("Forwarding request to Anthropic: model={}", model());

        return webClient.post()
                .uri(baseUrl() + "/v1/messages")
                .header("x-api-key", config.getApiKey())
                .header("anthropic-version", ANTHROPIC_VERSION)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(buildPayload(prompt))
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::classifyError)
                .bodyToMono(JsonNode.class)
                .map(response -> ProviderReply.builder()
                        .summary(requireText(extractText(response), "content[].text"))
                        .raw(response)
                        .build());
    }

    private ObjectNode buildPayload(String prompt) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", model());
        payload.put("max_tokens", config.getMaxTokens() != null ? config.getMaxTokens() : DEFAULT_MAX_TOKENS);

        // Anthropic uses an array of content blocks per message
        ArrayNode messages = payload.putArray("messages");
        ObjectNode userMessage = messages.addObject();
        userMessage.put("role", "user");
        ObjectNode textBlock = userMessage.putArray("content").addObject();
        textBlock.put("type", "text");
        textBlock.put("text", prompt);

        if (config.getTemperature() != null) {
            payload.put("temperature", config.getTemperature());
        }
        return payload;
    }

    private String extractText(JsonNode response) {
        JsonNode content = response.path("content");
        if (!content.isArray()) {
            return null;
        }

        StringBuilder text = new StringBuilder();
        for (JsonNode block : content) {
            if ("text".equals(block.path("type").asText())) {
                text.append(block.path("text").asText(""));
            }
        }
        return text.toString();
    }
}
