package com.aero.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Failure taxonomy of the gateway.
 */
public enum GatewayErrorKind {

    /**
     * Missing or malformed credential for the chosen provider.
     */
    CONFIGURATION("configuration"),

    /**
     * Provider signalled throttling (HTTP 429) on every allowed attempt.
     */
    RATE_LIMITED("rate_limited"),

    /**
     * Caller supplied an unusable request. The only hard failure.
     */
    MALFORMED_REQUEST("malformed_request"),

    /**
     * Network error, unexpected status or unexpected response shape.
     */
    PROVIDER_FAILURE("provider_failure");

    private final String code;

    GatewayErrorKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
