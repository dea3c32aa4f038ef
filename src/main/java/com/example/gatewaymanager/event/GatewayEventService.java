package com.example.gatewaymanager.event;

import com.example.gatewaymanager.exception.EventPayloadTooLargeException;
import com.example.gatewaymanager.gateway.GatewayConnection;
import com.example.gatewaymanager.gateway.GatewayConnectionManager;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

/**
 * Pushes events to connected gateways.
 *
 * Delivery is at-most-once: a gateway that is offline when an event is
 * broadcast never receives it and is expected to resync on reconnect.
 * Per-connection send failures are recorded in that connection's
 * {@link com.example.gatewaymanager.gateway.DeliveryStats} and never
 * propagated to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GatewayEventService {

    /** Ceiling on the serialized payload size. */
    public static final int MAX_PAYLOAD_BYTES = 1024 * 1024;

    private final GatewayConnectionManager connectionManager;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    /**
     * Outcome of a fan-out. Failures are informational only.
     */
    public record BroadcastResult(int sent, int failed, String correlationId) {

        BroadcastResult plus(BroadcastResult other) {
            return new BroadcastResult(sent + other.sent, failed + other.failed, correlationId);
        }
    }

    /**
     * Broadcast an event to every live connection of one gateway.
     *
     * @throws EventPayloadTooLargeException if the payload exceeds {@link #MAX_PAYLOAD_BYTES}
     */
    public BroadcastResult broadcastEvent(String gatewayId, String eventType, Object payload) {
        return broadcastEvent(gatewayId, eventType, payload, null);
    }

    public BroadcastResult broadcastEvent(String gatewayId, String eventType, Object payload, String userId) {
        String correlationId = UUID.randomUUID().toString();
        byte[] envelope = buildEnvelope(eventType, payload, correlationId, userId);
        BroadcastResult result = deliver(gatewayId, eventType, envelope, correlationId);
        log.info("Broadcast event: gatewayId={}, type={}, sent={}, failed={}, correlationId={}",
                gatewayId, eventType, result.sent(), result.failed(), correlationId);
        return result;
    }

    /**
     * Broadcast an event to every gateway that currently has a live connection.
     * The envelope, and therefore the correlation ID, is shared by all recipients.
     */
    public BroadcastResult broadcastToAllGateways(String eventType, Object payload) {
        String correlationId = UUID.randomUUID().toString();
        byte[] envelope = buildEnvelope(eventType, payload, correlationId, null);

        List<String> gatewayIds = connectionManager.getAllGatewayIds();
        BroadcastResult total = new BroadcastResult(0, 0, correlationId);
        for (String gatewayId : gatewayIds) {
            total = total.plus(deliver(gatewayId, eventType, envelope, correlationId));
        }
        log.info("Broadcast event to all gateways: type={}, gateways={}, sent={}, failed={}, correlationId={}",
                eventType, gatewayIds.size(), total.sent(), total.failed(), correlationId);
        return total;
    }

    public BroadcastResult broadcastAgentDeployed(String gatewayId, AgentDeployedEvent event, String userId) {
        return broadcastEvent(gatewayId, GatewayEventTypes.AGENT_DEPLOYED, event, userId);
    }

    public BroadcastResult broadcastAgentUndeployed(String gatewayId, AgentUndeployedEvent event, String userId) {
        return broadcastEvent(gatewayId, GatewayEventTypes.AGENT_UNDEPLOYED, event, userId);
    }

    public BroadcastResult broadcastConfigUpdated(String gatewayId, GatewayConfigEvent event, String userId) {
        return broadcastEvent(gatewayId, GatewayEventTypes.CONFIG_UPDATED, event, userId);
    }

    private byte[] buildEnvelope(String eventType, Object payload, String correlationId, String userId) {
        byte[] payloadBytes = serialize(payload, "payload");
        if (payloadBytes.length > MAX_PAYLOAD_BYTES) {
            throw new EventPayloadTooLargeException(MAX_PAYLOAD_BYTES);
        }

        GatewayEvent event = GatewayEvent.builder()
                .type(eventType)
                .payload(payload)
                .timestamp(GatewayEvent.timestampNow())
                .correlationId(correlationId)
                .userId(userId)
                .build();
        return serialize(event, "event");
    }

    private byte[] serialize(Object value, String what) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to marshal " + what + ": " + e.getOriginalMessage(), e);
        }
    }

    private BroadcastResult deliver(String gatewayId, String eventType, byte[] envelope, String correlationId) {
        List<GatewayConnection> connections = connectionManager.getConnections(gatewayId);
        if (connections.isEmpty()) {
            log.warn("No active connections for gateway: gatewayId={}, type={}", gatewayId, eventType);
            return new BroadcastResult(0, 0, correlationId);
        }

        int sent = 0;
        int failed = 0;
        for (GatewayConnection conn : connections) {
            try {
                conn.send(envelope);
                conn.getDeliveryStats().incrementTotalSent();
                sent++;
                log.debug("Event sent: gatewayId={}, connectionId={}, type={}, correlationId={}",
                        gatewayId, conn.getConnectionId(), eventType, correlationId);
            } catch (IOException | RuntimeException e) {
                conn.getDeliveryStats().incrementFailed("send error: " + e.getMessage());
                failed++;
                log.error("Failed to send event: gatewayId={}, connectionId={}, type={}, correlationId={}, error={}",
                        gatewayId, conn.getConnectionId(), eventType, correlationId, e.getMessage());
            }
        }

        counter("gateway.events.sent", eventType).increment(sent);
        counter("gateway.events.failed", eventType).increment(failed);
        return new BroadcastResult(sent, failed, correlationId);
    }

    private Counter counter(String name, String eventType) {
        return Counter.builder(name)
                .tag("type", eventType)
                .register(meterRegistry);
    }
}
