package com.example.gatewaymanager.exception;

/**
 * A remote gateway answered a management call with an unexpected status.
 */
public class GatewayOperationException extends RuntimeException {

    private final int statusCode;

    public GatewayOperationException(String operation, int statusCode) {
        super(operation + " failed with status " + statusCode);
        this.statusCode = statusCode;
    }

    public GatewayOperationException(String message) {
        super(message);
        this.statusCode = -1;
    }

    public GatewayOperationException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
