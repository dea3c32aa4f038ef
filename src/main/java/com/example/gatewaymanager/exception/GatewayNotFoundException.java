package com.example.gatewaymanager.exception;

/**
 * Exception thrown when a gateway is not found.
 */
public class GatewayNotFoundException extends RuntimeException {

    public GatewayNotFoundException(String gatewayId) {
        super("Gateway not found: " + gatewayId);
    }

    public GatewayNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    /** No gateway is registered under the presented API key. The key is not echoed. */
    public static GatewayNotFoundException forApiKey() {
        return new GatewayNotFoundException("Gateway not found for API key", null);
    }
}
