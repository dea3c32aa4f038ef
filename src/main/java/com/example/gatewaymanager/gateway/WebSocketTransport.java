package com.example.gatewaymanager.gateway;

import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * {@link Transport} backed by a Spring {@link WebSocketSession}.
 *
 * Broadcast sends and heartbeat pings arrive from different threads, so the
 * raw session is wrapped in a {@link ConcurrentWebSocketSessionDecorator},
 * which also enforces the write deadline ({@code sendTimeLimitMillis}).
 */
public class WebSocketTransport implements Transport {

    private final WebSocketSession session;
    private volatile Runnable pongHandler = () -> { };

    public WebSocketTransport(WebSocketSession session, int sendTimeLimitMillis, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMillis, bufferSizeLimit);
    }

    @Override
    public void send(byte[] message) throws IOException {
        session.sendMessage(new TextMessage(message));
    }

    @Override
    public void close(int code, String reason) throws IOException {
        session.close(new CloseStatus(code, reason));
    }

    @Override
    public void sendPing() throws IOException {
        session.sendMessage(new PingMessage());
    }

    @Override
    public void setPongHandler(Runnable handler) {
        this.pongHandler = handler;
    }

    /**
     * Called by the WebSocket handler when a pong frame arrives.
     */
    void onPong() {
        pongHandler.run();
    }

    public String getSessionId() {
        return session.getId();
    }
}
