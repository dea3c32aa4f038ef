package com.example.gatewaymanager.gateway;

import com.example.gatewaymanager.exception.ConnectionClosedException;
import lombok.AccessLevel;
import lombok.Getter;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * One live channel to a gateway process.
 * Owns exactly one {@link Transport} for its whole lifetime; once closed it is
 * never reopened.
 */
@Getter
public class GatewayConnection {

    private final String gatewayId;
    private final String connectionId;
    private final Instant connectedAt;
    private final Transport transport;
    private final String authToken;
    private final DeliveryStats deliveryStats = new DeliveryStats();

    @Getter(AccessLevel.NONE)
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    @Getter(AccessLevel.NONE)
    private Instant lastHeartbeat;
    @Getter(AccessLevel.NONE)
    private boolean closed;

    public GatewayConnection(String gatewayId, String connectionId, Transport transport, String authToken) {
        this.gatewayId = gatewayId;
        this.connectionId = connectionId;
        this.transport = transport;
        this.authToken = authToken;
        this.connectedAt = Instant.now();
        this.lastHeartbeat = connectedAt;
    }

    /**
     * Send a frame. Holds the read lock so concurrent sends proceed together
     * but cannot slip past a concurrent {@link #close}. Delivery statistics are
     * left to the caller.
     *
     * @throws ConnectionClosedException if the connection was already closed
     */
    public void send(byte[] message) throws IOException {
        lock.readLock().lock();
        try {
            if (closed) {
                throw new ConnectionClosedException(connectionId);
            }
            transport.send(message);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Close the connection. A second call is a no-op.
     */
    public void close(int code, String reason) throws IOException {
        lock.writeLock().lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            transport.close(code, reason);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isClosed() {
        lock.readLock().lock();
        try {
            return closed;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void updateHeartbeat() {
        lock.writeLock().lock();
        try {
            lastHeartbeat = Instant.now();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Instant getLastHeartbeat() {
        lock.readLock().lock();
        try {
            return lastHeartbeat;
        } finally {
            lock.readLock().unlock();
        }
    }

    public DeliveryStats.Snapshot getStats() {
        return deliveryStats.snapshot();
    }

    /**
     * Connection details for logging and the status API.
     */
    public Map<String, Object> getConnectionInfo() {
        lock.readLock().lock();
        try {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("gatewayId", gatewayId);
            info.put("connectionId", connectionId);
            info.put("connectedAt", connectedAt.toString());
            info.put("lastHeartbeat", lastHeartbeat.toString());
            info.put("closed", closed);
            return info;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String toString() {
        return "GatewayConnection{gatewayId=" + gatewayId + ", connectionId=" + connectionId + ", closed=" + isClosed() + "}";
    }
}
