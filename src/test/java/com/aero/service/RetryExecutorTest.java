package com.aero.service;

import com.aero.provider.ProviderResponseException;
import com.aero.provider.RateLimitedException;
import com.aero.provider.RetryExhaustedException;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RetryExecutor.
 */
class RetryExecutorTest {

    private static final Duration BASE_DELAY = Duration.ofMillis(20);

    private final RetryExecutor retryExecutor = new RetryExecutor(3, BASE_DELAY, Duration.ofMillis(5));

    @Test
    void testSucceedsAfterRateLimitedAttempts() {
        AtomicInteger attempts = new AtomicInteger();
        Mono<String> call = Mono.defer(() -> attempts.incrementAndGet() < 3
                ? Mono.error(new RateLimitedException("gemini", "429"))
                : Mono.just("ok"));

        long start = System.nanoTime();
        StepVerifier.create(retryExecutor.execute("gemini", call))
                .expectNext("ok")
                .verifyComplete();
        long elapsed = System.nanoTime() - start;

        assertEquals(3, attempts.get());
        // base + 2 * base before the third attempt
        assertTrue(elapsed >= BASE_DELAY.multipliedBy(3).toNanos());
    }

    @Test
    void testExhaustionAfterMaxAttempts() {
        AtomicInteger attempts = new AtomicInteger();
        Mono<String> call = Mono.defer(() -> {
            attempts.incrementAndGet();
            return Mono.error(new RateLimitedException("gemini", "429"));
        });

        StepVerifier.create(retryExecutor.execute("gemini", call))
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(RetryExhaustedException.class, error);
                    RetryExhaustedException exhausted = (RetryExhaustedException) error;
                    assertEquals(3, exhausted.getAttempts());
                    assertEquals("gemini", exhausted.getProviderId());
                    assertInstanceOf(RateLimitedException.class, exhausted.getCause());
                })
                .verify(Duration.ofSeconds(5));

        assertEquals(3, attempts.get());
    }

    @Test
    void testOtherFailuresAreNotRetried() {
        AtomicInteger attempts = new AtomicInteger();
        ProviderResponseException failure = new ProviderResponseException("openai", 500, "server error");
        Mono<String> call = Mono.defer(() -> {
            attempts.incrementAndGet();
            return Mono.error(failure);
        });

        StepVerifier.create(retryExecutor.execute("openai", call))
                .expectErrorMatches(error -> error == failure)
                .verify(Duration.ofSeconds(1));

        assertEquals(1, attempts.get());
    }

    @Test
    void testSingleAttemptPolicyExhaustsImmediately() {
        RetryExecutor noRetry = new RetryExecutor(1, BASE_DELAY, Duration.ZERO);
        AtomicInteger attempts = new AtomicInteger();
        Mono<String> call = Mono.defer(() -> {
            attempts.incrementAndGet();
            return Mono.error(new RateLimitedException("groq", "429"));
        });

        StepVerifier.create(noRetry.execute("groq", call))
                .expectError(RetryExhaustedException.class)
                .verify(Duration.ofSeconds(1));

        assertEquals(1, attempts.get());
    }

    @Test
    void testBackoffDoublesPerAttempt() {
        assertEquals(BASE_DELAY, retryExecutor.baseBackoff(1));
        assertEquals(BASE_DELAY.multipliedBy(2), retryExecutor.baseBackoff(2));
        assertEquals(BASE_DELAY.multipliedBy(4), retryExecutor.baseBackoff(3));
    }

    @Test
    void testFluxVariantRetriesWholeSequence() {
        AtomicInteger attempts = new AtomicInteger();
        Flux<String> call = Flux.defer(() -> attempts.incrementAndGet() < 2
                ? Flux.error(new RateLimitedException("openai", "429"))
                : Flux.just("Gradient ", "descent"));

        StepVerifier.create(retryExecutor.execute("openai", call))
                .expectNext("Gradient ", "descent")
                .verifyComplete();

        assertEquals(2, attempts.get());
    }
}
