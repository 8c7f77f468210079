package com.aero.config;

import com.aero.provider.AnthropicStrategy;
import com.aero.provider.GeminiStrategy;
import com.aero.provider.OpenAiCompatibleStrategy;
import com.aero.provider.ProviderKind;
import com.aero.provider.ProviderStrategy;
import com.aero.service.RateLimiter;
import com.aero.service.RetryExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * One strategy bean per provider kind. Every strategy is registered even without a
 * credential; availability is checked per call.
 */
@Configuration
public class ProviderConfiguration {

    private final GatewayProperties properties;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final RateLimiter rateLimiter;
    private final RetryExecutor retryExecutor;

    public ProviderConfiguration(GatewayProperties properties,
                                 WebClient webClient,
                                 ObjectMapper objectMapper,
                                 RateLimiter rateLimiter,
                                 RetryExecutor retryExecutor) {
        this.properties = properties;
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.rateLimiter = rateLimiter;
        this.retryExecutor = retryExecutor;
    }

    @Bean
    public ProviderStrategy openAiStrategy() {
        return openAiCompatible(ProviderKind.OPENAI);
    }

    @Bean
    public ProviderStrategy deepSeekStrategy() {
        return openAiCompatible(ProviderKind.DEEPSEEK);
    }

    @Bean
    public ProviderStrategy groqStrategy() {
        return openAiCompatible(ProviderKind.GROQ);
    }

    @Bean
    public ProviderStrategy searchStrategy() {
        return openAiCompatible(ProviderKind.SEARCH);
    }

    @Bean
    public ProviderStrategy geminiStrategy() {
        return new GeminiStrategy(properties.provider(ProviderKind.GEMINI.getId()),
                webClient, objectMapper, rateLimiter, retryExecutor);
    }

    @Bean
    public ProviderStrategy anthropicStrategy() {
        return new AnthropicStrategy(properties.provider(ProviderKind.ANTHROPIC.getId()),
                webClient, objectMapper, rateLimiter, retryExecutor);
    }

    private ProviderStrategy openAiCompatible(ProviderKind kind) {
        return new OpenAiCompatibleStrategy(kind, properties.provider(kind.getId()),
                webClient, objectMapper, rateLimiter, retryExecutor);
    }
}
