package com.aero.provider;

import com.aero.config.GatewayProperties;
import com.aero.model.ProviderReply;
import com.aero.service.RateLimiter;
import com.aero.service.RetryExecutor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Google Gemini {@code generateContent} strategy.
 */
@Slf4j
public class GeminiStrategy extends AbstractProviderStrategy {

    private static final String API_KEY_HEADER = "x-goog-api-key";

    private final WebClient webClient;

    public GeminiStrategy(
            GatewayProperties.ProviderConfig config,
            WebClient webClient,
            ObjectMapper objectMapper,
            RateLimiter rateLimiter,
            RetryExecutor retryExecutor) {
        super(ProviderKind.GEMINI, config, objectMapper, rateLimiter, retryExecutor);
        this.webClient = webClient;
    }

    @Override
    protected Mono<ProviderReply> exchange(String prompt) {
        log.info("Forwarding request to Gemini: model={}", model());

        return webClient.post()
                .uri(baseUrl() + "/models/" + model() + ":generateContent")
                .header(API_KEY_HEADER, config.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(buildPayload(prompt))
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::classifyError)
                .bodyToMono(JsonNode.class)
                .map(response -> ProviderReply.builder()
                        .summary(requireText(extractText(response), "candidates[0].content.parts[].text"))
                        .raw(response)
                        .build());
    }

    private ObjectNode buildPayload(String prompt) {
        ObjectNode payload = objectMapper.createObjectNode();

        ObjectNode content = payload.putArray("contents").addObject();
        content.put("role", "user");
        content.putArray("parts").addObject().put("text", prompt);

        if (config.getTemperature() != null || config.getMaxTokens() != null) {
            ObjectNode generationConfig = payload.putObject("generationConfig");
            if (config.getTemperature() != null) {
                generationConfig.put("temperature", config.getTemperature());
            }
            if (config.getMaxTokens() != null) {
                generationConfig.put("maxOutputTokens", config.getMaxTokens());
            }
        }
        return payload;
    }

    /**
     * Join the text parts of the first candidate, one part per line.
     */
    private String extractText(JsonNode response) {
        JsonNode parts = response.path("candidates").path(0).path("content").path("parts");
        if (!parts.isArray()) {
            return null;
        }

        List<String> texts = new ArrayList<>();
        for (JsonNode part : parts) {
            String text = part.path("text").asText("");
            if (!text.isEmpty()) {
                texts.add(text);
            }
        }
        return String.join("\n", texts);
    }
}
