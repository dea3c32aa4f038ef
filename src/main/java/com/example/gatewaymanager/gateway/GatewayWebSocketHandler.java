package com.example.gatewaymanager.gateway;

import com.example.gatewaymanager.config.GatewayManagerProperties;
import com.example.gatewaymanager.event.GatewayEvent;
import com.example.gatewaymanager.exception.ConnectionLimitExceededException;
import com.example.gatewaymanager.service.GatewayService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;

/**
 * WebSocket endpoint for gateway processes.
 *
 * The handshake has already been authenticated by {@link ApiKeyHandshakeInterceptor}.
 * Each accepted session is wrapped in a {@link WebSocketTransport}, registered
 * with the {@link GatewayConnectionManager} and acknowledged. The container's
 * per-session read loop drives the remaining callbacks; each callback is a
 * fault boundary that only ever tears down its own connection.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GatewayWebSocketHandler extends TextWebSocketHandler {

    static final String ATTR_CONNECTION = "gatewayConnection";
    static final String ATTR_TRANSPORT = "gatewayTransport";

    /** Retryable close code sent when the connection ceiling is reached. */
    static final CloseStatus TRY_AGAIN_LATER = new CloseStatus(1013, "connection limit reached");

    static final CloseStatus SERVER_SHUTDOWN = CloseStatus.GOING_AWAY.withReason("server shutdown");

    private final GatewayConnectionManager connectionManager;
    private final GatewayService gatewayService;
    private final GatewayManagerProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String gatewayId = (String) session.getAttributes().get(ApiKeyHandshakeInterceptor.ATTR_GATEWAY_ID);
        String apiKey = (String) session.getAttributes().get(ApiKeyHandshakeInterceptor.ATTR_API_KEY);

        GatewayManagerProperties.WebSocketEndpointConfig ws = properties.getWebsocket();
        WebSocketTransport transport = new WebSocketTransport(session,
                ws.getSendTimeLimitSeconds() * 1000, ws.getSendBufferSizeLimit());

        GatewayConnection connection;
        try {
            connection = connectionManager.register(gatewayId, transport, apiKey);
        } catch (ConnectionLimitExceededException e) {
            log.error("Connection registration failed: gatewayId={}, error={}", gatewayId, e.getMessage());
            rejectConnection(transport, gatewayId, e.getMessage(), TRY_AGAIN_LATER);
            return;
        } catch (IllegalStateException e) {
            log.warn("Connection refused during shutdown: gatewayId={}", gatewayId);
            rejectConnection(transport, gatewayId, e.getMessage(), SERVER_SHUTDOWN);
            return;
        }

        session.getAttributes().put(ATTR_CONNECTION, connection);
        session.getAttributes().put(ATTR_TRANSPORT, transport);

        sendAck(connection);

        log.info("WebSocket connection established: gatewayId={}, connectionId={}, address={}",
                gatewayId, connection.getConnectionId(), session.getRemoteAddress());

        syncActiveStatus(gatewayId);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        GatewayConnection connection = connectionOf(session);
        if (connection == null) {
            return;
        }
        try {
            JsonNode frame = objectMapper.readTree(message.getPayload());
            log.debug("Inbound frame: gatewayId={}, connectionId={}, type={}",
                    connection.getGatewayId(), connection.getConnectionId(), frame.path("type").asText("unknown"));
        } catch (JsonProcessingException e) {
            log.warn("Malformed inbound frame: gatewayId={}, connectionId={}",
                    connection.getGatewayId(), connection.getConnectionId());
        } catch (RuntimeException e) {
            log.error("Error handling WebSocket message: gatewayId={}, connectionId={}",
                    connection.getGatewayId(), connection.getConnectionId(), e);
            connectionManager.unregister(connection.getGatewayId(), connection.getConnectionId());
        }
    }

    @Override
    protected void handlePongMessage(WebSocketSession session, PongMessage message) {
        WebSocketTransport transport = (WebSocketTransport) session.getAttributes().get(ATTR_TRANSPORT);
        if (transport != null) {
            transport.onPong();
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        GatewayConnection connection = connectionOf(session);
        if (connection == null) {
            log.error("Transport error for session {}: {}", session.getId(), exception.getMessage());
            return;
        }
        log.error("WebSocket read error: gatewayId={}, connectionId={}, error={}",
                connection.getGatewayId(), connection.getConnectionId(), exception.getMessage());
        connectionManager.unregister(connection.getGatewayId(), connection.getConnectionId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        GatewayConnection connection = connectionOf(session);
        if (connection == null) {
            return;
        }
        String gatewayId = connection.getGatewayId();

        if (isExpectedClosure(status)) {
            log.info("WebSocket connection closed: gatewayId={}, connectionId={}, code={}",
                    gatewayId, connection.getConnectionId(), status.getCode());
        } else {
            log.error("WebSocket connection closed abnormally: gatewayId={}, connectionId={}, code={}, reason={}",
                    gatewayId, connection.getConnectionId(), status.getCode(), status.getReason());
        }

        connectionManager.unregister(gatewayId, connection.getConnectionId());
        syncActiveStatus(gatewayId);
    }

    /**
     * Write the gateway's active flag from the registry and re-read the registry
     * afterwards. A connect or disconnect that lands between the read and the
     * write makes the two disagree, and the flag is written again.
     */
    void syncActiveStatus(String gatewayId) {
        boolean active = !connectionManager.getConnections(gatewayId).isEmpty();
        while (true) {
            try {
                gatewayService.updateGatewayActiveStatus(gatewayId, active);
            } catch (RuntimeException e) {
                log.error("Failed to update gateway active status: gatewayId={}, active={}, error={}",
                        gatewayId, active, e.getMessage());
                return;
            }
            boolean current = !connectionManager.getConnections(gatewayId).isEmpty();
            if (current == active) {
                return;
            }
            active = current;
        }
    }

    static boolean isExpectedClosure(CloseStatus status) {
        return status.getCode() == CloseStatus.NORMAL.getCode() || status.getCode() == CloseStatus.GOING_AWAY.getCode();
    }

    private void sendAck(GatewayConnection connection) {
        ConnectionAck ack = ConnectionAck.builder()
                .gatewayId(connection.getGatewayId())
                .connectionId(connection.getConnectionId())
                .timestamp(GatewayEvent.timestampNow())
                .build();
        try {
            connection.send(objectMapper.writeValueAsBytes(ack));
        } catch (IOException | RuntimeException e) {
            log.error("Failed to send connection ACK: gatewayId={}, connectionId={}, error={}",
                    connection.getGatewayId(), connection.getConnectionId(), e.getMessage());
        }
    }

    private void rejectConnection(Transport transport, String gatewayId, String message, CloseStatus status) {
        try {
            transport.send(objectMapper.writeValueAsBytes(Map.of("type", "error", "message", message)));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize error frame: gatewayId={}", gatewayId, e);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to send error message: gatewayId={}, error={}", gatewayId, e.getMessage());
        }
        try {
            transport.close(status.getCode(), status.getReason());
        } catch (IOException | RuntimeException e) {
            log.error("Failed to close connection: gatewayId={}, error={}", gatewayId, e.getMessage());
        }
    }

    private static GatewayConnection connectionOf(WebSocketSession session) {
        return (GatewayConnection) session.getAttributes().get(ATTR_CONNECTION);
    }
}
