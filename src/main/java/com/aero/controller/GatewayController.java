package com.aero.controller;

import com.aero.model.GatewayData;
import com.aero.model.GatewayEnvelope;
import com.aero.model.GatewayHeaders;
import com.aero.model.GatewayRequest;
import com.aero.service.GatewayService;
import com.aero.service.ProviderRegistry;
import com.aero.service.StreamAdapter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Text generation endpoint with provenance headers.
 * Supports both regular JSON responses and NDJSON streaming.
 */
@Slf4j
@RestController
@RequestMapping("/api")
public class GatewayController {

    private final GatewayService gatewayService;
    private final StreamAdapter streamAdapter;
    private final ProviderRegistry providerRegistry;

    public GatewayController(GatewayService gatewayService,
                             StreamAdapter streamAdapter,
                             ProviderRegistry providerRegistry) {
        this.gatewayService = gatewayService;
        this.streamAdapter = streamAdapter;
        this.providerRegistry = providerRegistry;
    }

    /**
     * Generate a summary for a prompt.
     * Streaming requests are written as NDJSON directly to the response, one flush per line.
     */
    @PostMapping(value = "/generate",
                 consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<GatewayEnvelope>> generate(
            @RequestBody(required = false) GatewayRequest request,
            ServerHttpResponse response) {
        // Validate request
        if (request == null) {
            throw new MalformedRequestException("Request body is required");
        }
        if (request.getPrompt() == null || request.getPrompt().isBlank()) {
            throw new MalformedRequestException("Prompt must not be empty");
        }

        log.info("Received generate request for provider: {}, streaming: {}",
                request.getProviderId(), request.isStreamingRequested());

        if (request.isStreamingRequested()) {
            return handleStreamingRequest(request, response);
        }
        return handleRegularRequest(request);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", true);
        body.put("message", "AERO gateway is running");
        body.put("defaultProvider", providerRegistry.getDefaultProviderId());
        body.put("providers", providerRegistry.availability());
        return ResponseEntity.ok(body);
    }

    private Mono<ResponseEntity<GatewayEnvelope>> handleRegularRequest(GatewayRequest request) {
        return gatewayService.generate(request)
                .map(result -> ResponseEntity.ok()
                        .headers(provenanceHeaders(result.getData()))
                        .body(result.toEnvelope()));
    }

    private Mono<ResponseEntity<GatewayEnvelope>> handleStreamingRequest(GatewayRequest request,
                                                                        ServerHttpResponse response) {
        HttpHeaders headers = response.getHeaders();
        headers.setContentType(MediaType.APPLICATION_NDJSON);
        headers.setCacheControl("no-cache");

        Flux<String> lines = streamAdapter.toNdjson(gatewayService.stream(request));
        return response.writeAndFlushWith(lines.map(line -> Mono.just(
                        response.bufferFactory().wrap(line.getBytes(StandardCharsets.UTF_8)))))
                .then(Mono.empty());
    }

    private HttpHeaders provenanceHeaders(GatewayData data) {
        HttpHeaders headers = new HttpHeaders();
        headers.add(GatewayHeaders.CACHE_HIT, String.valueOf(data.isCached()));
        headers.add(GatewayHeaders.PROVIDER, data.getProvider());

        if (data.getCacheAgeSeconds() != null) {
            headers.add(GatewayHeaders.CACHE_AGE, String.valueOf(data.getCacheAgeSeconds()));
        }

        if (data.getServedBy() != null && !data.getServedBy().equals(data.getProvider())) {
            headers.add(GatewayHeaders.SERVED_BY, data.getServedBy());
        }

        if (Boolean.TRUE.equals(data.getDegraded())) {
            headers.add(GatewayHeaders.DEGRADED, "true");
            if (data.getReason() != null) {
                headers.add(GatewayHeaders.DEGRADED_REASON, data.getReason().getCode());
            }
        }
        return headers;
    }
}
