package com.example.gatewaymanager.exception;

/**
 * Base type for credential vault failures.
 */
public class CredentialEncryptionException extends RuntimeException {

    public CredentialEncryptionException(String message) {
        super(message);
    }

    public CredentialEncryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
