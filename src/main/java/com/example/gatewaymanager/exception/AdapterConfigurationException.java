package com.example.gatewaymanager.exception;

/**
 * Gateway adapter configuration is missing or unusable (for example no
 * {@code controlPlaneUrl}, or no stored credentials). Not a retry case.
 */
public class AdapterConfigurationException extends RuntimeException {

    public AdapterConfigurationException(String message) {
        super(message);
    }
}
