package com.aero.provider;

import com.aero.model.GatewayErrorKind;

/**
 * Every allowed attempt was rate limited.
 */
public class RetryExhaustedException extends ProviderException {

    private final int attempts;

    public RetryExhaustedException(String providerId, int attempts, Throwable lastFailure) {
        super(providerId, GatewayErrorKind.RATE_LIMITED,
                "Provider " + providerId + " still rate limited after " + attempts + " attempts",
                lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
