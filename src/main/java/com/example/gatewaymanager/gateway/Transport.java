package com.example.gatewaymanager.gateway;

import java.io.IOException;

/**
 * A single bidirectional message channel to one gateway process.
 * Keeps the connection registry independent of the wire protocol; the
 * production implementation wraps a WebSocket session.
 */
public interface Transport {

    /**
     * Send one text frame.
     */
    void send(byte[] message) throws IOException;

    /**
     * Send a close frame with the given status code and release the channel.
     */
    void close(int code, String reason) throws IOException;

    /**
     * Send a keep-alive probe. The peer's acknowledgment is delivered to the
     * handler installed through {@link #setPongHandler(Runnable)}.
     */
    void sendPing() throws IOException;

    void setPongHandler(Runnable handler);
}
