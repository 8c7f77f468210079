package com.aero.service;

import com.aero.config.GatewayProperties;
import com.aero.provider.RateLimitedException;
import com.aero.provider.RetryExhaustedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded exponential-backoff retry for rate-limited provider calls.
 *
 * <p>Attempt {@code n} that fails with {@link RateLimitedException} is followed, while
 * {@code n < maxAttempts}, by a pause of {@code baseDelay * 2^(n-1)} plus a random jitter
 * in {@code [0, jitterBound]}. The last rate-limited attempt ends in
 * {@link RetryExhaustedException}. Any other failure propagates at once.
 */
@Slf4j
@Component
public class RetryExecutor {

    private static final int MAX_SHIFT = 30;

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration jitterBound;

    @Autowired
    public RetryExecutor(GatewayProperties properties) {
        this(properties.getRetry().getMaxAttempts(),
                properties.getRetry().getBaseDelay(),
                properties.getRetry().getJitterBound());
    }

    public RetryExecutor(int maxAttempts, Duration baseDelay, Duration jitterBound) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseDelay = baseDelay;
        this.jitterBound = jitterBound;
    }

    public <T> Mono<T> execute(String providerId, Mono<T> call) {
        return call.retryWhen(policy(providerId));
    }

    public <T> Flux<T> execute(String providerId, Flux<T> call) {
        return call.retryWhen(policy(providerId));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Backoff before the attempt following attempt {@code attempt}, without jitter.
     *
     * @param attempt 1-based number of the attempt that was rate limited
     */
    public Duration baseBackoff(int attempt) {
        int shift = Math.min(Math.max(attempt - 1, 0), MAX_SHIFT);
        return baseDelay.multipliedBy(1L << shift);
    }

    private Duration backoff(int attempt) {
        long jitterNanos = jitterBound.isZero() || jitterBound.isNegative()
                ? 0
                : ThreadLocalRandom.current().nextLong(jitterBound.toNanos() + 1);
        return baseBackoff(attempt).plusNanos(jitterNanos);
    }

    private Retry policy(String providerId) {
        return Retry.from(signals -> signals.concatMap(signal -> {
            Throwable failure = signal.failure();
            if (!(failure instanceof RateLimitedException)) {
                return Mono.<Long>error(failure);
            }

            int attempt = (int) signal.totalRetries() + 1;
            if (attempt >= maxAttempts) {
                log.warn("Provider {} rate limited on all {} attempts, giving up", providerId, attempt);
                return Mono.<Long>error(new RetryExhaustedException(providerId, attempt, failure));
            }

            Duration delay = backoff(attempt);
            log.warn("Provider {} rate limited on attempt {}/{}, retrying in {} ms",
                    providerId, attempt, maxAttempts, delay.toMillis());
            return Mono.delay(delay);
        }));
    }
}
