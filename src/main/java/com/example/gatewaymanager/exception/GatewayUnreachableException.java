package com.example.gatewaymanager.exception;

/**
 * Network-level failure talking to a remote gateway control plane.
 * The adapter never retries; retry policy belongs to the caller.
 */
public class GatewayUnreachableException extends RuntimeException {

    public GatewayUnreachableException(String message, Throwable cause) {
        super(message, cause);
    }
}
