package com.aero.provider;

import com.aero.model.GatewayErrorKind;

/**
 * Base class for classified provider failures.
 */
public class ProviderException extends RuntimeException {

    private final String providerId;
    private final GatewayErrorKind kind;

    public ProviderException(String providerId, GatewayErrorKind kind, String message) {
        super(message);
        this.providerId = providerId;
        this.kind = kind;
    }

    public ProviderException(String providerId, GatewayErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.providerId = providerId;
        this.kind = kind;
    }

    public String getProviderId() {
        return providerId;
    }

    public GatewayErrorKind getKind() {
        return kind;
    }
}
