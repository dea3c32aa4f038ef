package com.example.gatewaymanager.exception;

/**
 * Thrown when the global WebSocket connection ceiling has been reached.
 * Existing connections are never evicted to make room.
 */
public class ConnectionLimitExceededException extends RuntimeException {

    private final int maxConnections;

    public ConnectionLimitExceededException(int maxConnections) {
        super("maximum connection limit reached (" + maxConnections + ")");
        this.maxConnections = maxConnections;
    }

    public int getMaxConnections() {
        return maxConnections;
    }
}
