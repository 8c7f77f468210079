package com.aero.service;

import com.aero.config.JacksonConfiguration;
import com.aero.model.GatewayData;
import com.aero.model.GatewayResult;
import com.aero.model.StreamUpdate;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StreamAdapter.
 */
class StreamAdapterTest {

    private final StreamAdapter streamAdapter = new StreamAdapter(JacksonConfiguration.gatewayObjectMapper());

    @Test
    void testOneLinePerUpdateInOrder() {
        Flux<StreamUpdate> updates = Flux.just(
                StreamUpdate.start("gemini", false),
                StreamUpdate.delta("Gradient "),
                StreamUpdate.delta("descent"),
                StreamUpdate.done(GatewayResult.success(GatewayData.builder()
                        .summary("Gradient descent")
                        .provider("gemini")
                        .build())));

        List<String> lines = streamAdapter.toNdjson(updates).collectList().block();

        assertNotNull(lines);
        assertEquals(4, lines.size());
        for (String line : lines) {
            assertTrue(line.endsWith("\n"));
            assertEquals(line.length() - 1, line.indexOf('\n'), "exactly one newline per element");
        }
        assertTrue(lines.get(0).contains("\"type\":\"start\""));
        assertTrue(lines.get(1).contains("\"delta\":\"Gradient \""));
        assertTrue(lines.get(2).contains("\"delta\":\"descent\""));
        assertTrue(lines.get(3).contains("\"type\":\"done\""));
        assertTrue(lines.get(3).contains("\"summary\":\"Gradient descent\""));
    }

    @Test
    void testNewlinesInsideTextAreEscaped() {
        StepVerifier.create(streamAdapter.toNdjson(Flux.just(StreamUpdate.delta("line one\nline two"))))
                .assertNext(line -> {
                    assertTrue(line.contains("\"delta\":\"line one\\nline two\""));
                    assertEquals(line.length() - 1, line.indexOf('\n'));
                })
                .verifyComplete();
    }

    @Test
    void testSerializationFailureBecomesErrorLine() {
        StepVerifier.create(streamAdapter.toNdjson(Flux.just(new Unserializable())))
                .expectNext(StreamAdapter.SERIALIZATION_FAILURE_LINE)
                .verifyComplete();
    }

    @Test
    void testCancellationStopsProducer() {
        AtomicInteger produced = new AtomicInteger();
        AtomicLong largestRequest = new AtomicLong();
        AtomicBoolean cancelled = new AtomicBoolean();

        Flux<StreamUpdate> producer = Flux.range(1, 1_000)
                .doOnRequest(n -> largestRequest.accumulateAndGet(n, Math::max))
                .doOnNext(i -> produced.incrementAndGet())
                .doOnCancel(() -> cancelled.set(true))
                .map(i -> StreamUpdate.delta("chunk " + i));

        StepVerifier.create(streamAdapter.toNdjson(producer).take(2))
                .expectNextCount(2)
                .verifyComplete();

        assertTrue(cancelled.get());
        assertEquals(1, largestRequest.get());
        assertTrue(produced.get() <= 3);
    }

    static class Unserializable {
        public String getValue() {
            throw new IllegalStateException("boom");
        }
    }
}
