package com.aero.provider;

import com.aero.model.GatewayErrorKind;

/**
 * Provider returned an error status (other than 429) or a body without usable text.
 */
public class ProviderResponseException extends ProviderException {

    private final Integer statusCode;

    public ProviderResponseException(String providerId, Integer statusCode, String message) {
        super(providerId, GatewayErrorKind.PROVIDER_FAILURE, message);
        this.statusCode = statusCode;
    }

    public ProviderResponseException(String providerId, String message, Throwable cause) {
        super(providerId, GatewayErrorKind.PROVIDER_FAILURE, message, cause);
        this.statusCode = null;
    }

    /**
     * HTTP status of the failed exchange, or null when the failure was in the body.
     */
    public Integer getStatusCode() {
        return statusCode;
    }
}
