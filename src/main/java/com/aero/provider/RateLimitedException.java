package com.aero.provider;

import com.aero.model.GatewayErrorKind;

/**
 * Provider answered with HTTP 429. The only failure that is retried.
 */
public class RateLimitedException extends ProviderException {

    public RateLimitedException(String providerId, String message) {
        super(providerId, GatewayErrorKind.RATE_LIMITED, message);
    }
}
