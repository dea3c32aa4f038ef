package com.example.gatewaymanager.exception;

/**
 * Thrown when sending on a connection that has already been closed.
 */
public class ConnectionClosedException extends RuntimeException {

    public ConnectionClosedException(String connectionId) {
        super("connection is closed: " + connectionId);
    }
}
