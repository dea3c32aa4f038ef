package com.example.gatewaymanager.exception;

/**
 * Exception thrown when a provider does not exist on the remote gateway.
 */
public class ProviderNotFoundException extends RuntimeException {

    private final String providerId;

    public ProviderNotFoundException(String providerId) {
        super("provider not found: " + providerId);
        this.providerId = providerId;
    }

    public String getProviderId() {
        return providerId;
    }
}
