package com.aero.provider;

import com.aero.model.GatewayErrorKind;

/**
 * Chosen provider cannot be called with the current configuration.
 */
public class ProviderConfigurationException extends ProviderException {

    public ProviderConfigurationException(String providerId, String message) {
        super(providerId, GatewayErrorKind.CONFIGURATION, message);
    }
}
