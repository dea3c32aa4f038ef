package com.example.gatewaymanager.exception;

/**
 * Broadcast payload exceeded the size ceiling; nothing was sent.
 */
public class EventPayloadTooLargeException extends RuntimeException {

    public EventPayloadTooLargeException(int maxBytes) {
        super("event payload exceeds maximum size of " + maxBytes + " bytes");
    }
}
