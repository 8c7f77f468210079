package com.aero.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

/**
 * Turns a producer of updates into newline-delimited JSON lines.
 *
 * <p>Demand is requested one element at a time, so a client that stops reading
 * stops the producer too.
 */
@Slf4j
@Component
public class StreamAdapter {

    static final String SERIALIZATION_FAILURE_LINE =
            "{\"ok\":false,\"error\":{\"kind\":\"provider_failure\",\"message\":\"Failed to serialize stream update\"}}\n";

    private final ObjectWriter writer;

    public StreamAdapter(ObjectMapper objectMapper) {
        this.writer = objectMapper.writer();
    }

    public Flux<String> toNdjson(Flux<?> producer) {
        return producer
                .limitRate(1)
                .map(this::toLine)
                .doOnCancel(() -> log.info("Stream consumer went away, cancelling producer"));
    }

    String toLine(Object update) {
        try {
            return writer.writeValueAsString(update) + "\n";
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize stream update {}", update.getClass().getSimpleName(), e);
            return SERIALIZATION_FAILURE_LINE;
        }
    }
}
