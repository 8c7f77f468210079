package com.aero.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient configuration for outbound calls to text generation providers.
 */
@Configuration
public class WebClientConfiguration {

    // Provider payloads (Gemini candidates, full chat completions) can exceed the 256K default
    private static final int MAX_IN_MEMORY_SIZE = 4 * 1024 * 1024;

    private final GatewayProperties properties;

    public WebClientConfiguration(GatewayProperties properties) {
        this.properties = properties;
    }

    @Bean
    public WebClient webClient() {
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(properties.getProxy().getTimeout());

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE))
                .build();
    }
}
