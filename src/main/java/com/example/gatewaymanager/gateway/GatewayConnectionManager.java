package com.example.gatewaymanager.gateway;

import com.example.gatewaymanager.exception.ConnectionLimitExceededException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Registry of live gateway connections.
 *
 * Connections are keyed by gateway ID; a gateway may hold several at once and
 * none of them is evicted when another arrives. Every connection gets its own
 * heartbeat task which pings the peer on a fixed interval and unregisters the
 * connection when the peer stops answering or the ping fails.
 *
 * The map is concurrent, but replacing a gateway's connection list and
 * adjusting the global count happen together under one lock so that
 * {@link #getConnectionCount()} always equals the number of listed connections.
 * Transport I/O is never performed while that lock is held.
 */
@Slf4j
public class GatewayConnectionManager {

    public static final int CLOSE_NORMAL = 1000;
    public static final int CLOSE_GOING_AWAY = 1001;

    private final ConcurrentMap<String, List<GatewayConnection>> connections = new ConcurrentHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private int connectionCount;

    private final int maxConnections;
    private final Duration heartbeatInterval;
    private final Duration heartbeatTimeout;
    private final ExecutorService heartbeatExecutor;

    private final CountDownLatch shutdownSignal = new CountDownLatch(1);
    private final AtomicBoolean shutdown = new AtomicBoolean();

    public GatewayConnectionManager(int maxConnections, Duration heartbeatInterval, Duration heartbeatTimeout,
                                    ExecutorService heartbeatExecutor) {
        if (maxConnections <= 0) {
            throw new IllegalArgumentException("maxConnections must be positive");
        }
        if (heartbeatInterval.compareTo(heartbeatTimeout) >= 0) {
            log.warn("Heartbeat interval {} is not smaller than heartbeat timeout {}; live connections may be reaped",
                    heartbeatInterval, heartbeatTimeout);
        }
        this.maxConnections = maxConnections;
        this.heartbeatInterval = heartbeatInterval;
        this.heartbeatTimeout = heartbeatTimeout;
        this.heartbeatExecutor = heartbeatExecutor;
    }

    /**
     * Register a new connection for a gateway and start supervising it.
     *
     * @throws ConnectionLimitExceededException if the global ceiling is reached
     * @throws IllegalStateException if the manager has been shut down
     */
    public GatewayConnection register(String gatewayId, Transport transport, String authToken) {
        GatewayConnection connection = new GatewayConnection(gatewayId, UUID.randomUUID().toString(), transport, authToken);
        int total;

        lock.lock();
        try {
            if (shutdown.get()) {
                throw new IllegalStateException("connection manager is shut down");
            }
            if (connectionCount >= maxConnections) {
                throw new ConnectionLimitExceededException(maxConnections);
            }
            List<GatewayConnection> updated = new ArrayList<>(connections.getOrDefault(gatewayId, List.of()));
            updated.add(connection);
            connections.put(gatewayId, List.copyOf(updated));
            total = ++connectionCount;
        } finally {
            lock.unlock();
        }

        transport.setPongHandler(connection::updateHeartbeat);
        try {
            heartbeatExecutor.execute(() -> monitorHeartbeat(connection));
        } catch (RejectedExecutionException e) {
            // shutdown raced this registration
            unregister(gatewayId, connection.getConnectionId());
            throw new IllegalStateException("connection manager is shut down", e);
        }

        log.info("Gateway connected: gatewayId={}, connectionId={}, totalConnections={}",
                gatewayId, connection.getConnectionId(), total);
        return connection;
    }

    /**
     * Remove one connection and close its transport with a normal-closure code.
     * Unknown or already removed connections are ignored.
     */
    public void unregister(String gatewayId, String connectionId) {
        GatewayConnection removed = null;
        int total;

        lock.lock();
        try {
            List<GatewayConnection> current = connections.get(gatewayId);
            if (current == null) {
                return;
            }
            List<GatewayConnection> remaining = new ArrayList<>(current.size());
            for (GatewayConnection conn : current) {
                if (removed == null && conn.getConnectionId().equals(connectionId)) {
                    removed = conn;
                } else {
                    remaining.add(conn);
                }
            }
            if (removed == null) {
                return;
            }
            if (remaining.isEmpty()) {
                connections.remove(gatewayId);
            } else {
                connections.put(gatewayId, List.copyOf(remaining));
            }
            total = --connectionCount;
        } finally {
            lock.unlock();
        }

        closeQuietly(removed, CLOSE_NORMAL, "normal closure");

        log.info("Gateway disconnected: gatewayId={}, connectionId={}, totalConnections={}",
                gatewayId, connectionId, total);
    }

    /**
     * Snapshot of a gateway's live connections; empty when none.
     */
    public List<GatewayConnection> getConnections(String gatewayId) {
        return connections.getOrDefault(gatewayId, List.of());
    }

    public int getConnectionCount() {
        lock.lock();
        try {
            return connectionCount;
        } finally {
            lock.unlock();
        }
    }

    public List<String> getAllGatewayIds() {
        return new ArrayList<>(connections.keySet());
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    /**
     * Aggregate delivery statistics across every live connection.
     */
    public Map<String, Object> getStats() {
        int totalGateways = 0;
        long totalSent = 0;
        long totalFailed = 0;
        for (List<GatewayConnection> conns : connections.values()) {
            totalGateways++;
            for (GatewayConnection conn : conns) {
                DeliveryStats.Snapshot stats = conn.getStats();
                totalSent += stats.totalSent();
                totalFailed += stats.failedDeliveries();
            }
        }

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("totalConnections", getConnectionCount());
        stats.put("totalGateways", totalGateways);
        stats.put("totalEventsSent", totalSent);
        stats.put("totalFailedEvents", totalFailed);
        return stats;
    }

    /**
     * Stop heartbeat supervision, close every live connection and wait for all
     * heartbeat tasks to exit.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down gateway connection manager: activeConnections={}", getConnectionCount());
        shutdownSignal.countDown();

        List<GatewayConnection> live = new ArrayList<>();
        lock.lock();
        try {
            connections.values().forEach(live::addAll);
            connections.clear();
            connectionCount = 0;
        } finally {
            lock.unlock();
        }

        for (GatewayConnection conn : live) {
            closeQuietly(conn, CLOSE_GOING_AWAY, "server shutdown");
        }

        heartbeatExecutor.shutdown();
        try {
            while (!heartbeatExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Waiting for heartbeat tasks to finish");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for heartbeat tasks to finish");
        }

        log.info("Gateway connection manager shutdown complete");
    }

    private void monitorHeartbeat(GatewayConnection conn) {
        long intervalMillis = heartbeatInterval.toMillis();
        try {
            while (!shutdownSignal.await(intervalMillis, TimeUnit.MILLISECONDS)) {
                if (conn.isClosed()) {
                    return;
                }

                Duration sinceHeartbeat = Duration.between(conn.getLastHeartbeat(), Instant.now());
                if (sinceHeartbeat.compareTo(heartbeatTimeout) > 0) {
                    log.warn("Heartbeat timeout: gatewayId={}, connectionId={}, elapsed={}s",
                            conn.getGatewayId(), conn.getConnectionId(), sinceHeartbeat.toSeconds());
                    unregister(conn.getGatewayId(), conn.getConnectionId());
                    return;
                }

                try {
                    conn.getTransport().sendPing();
                } catch (IOException | RuntimeException e) {
                    log.error("Failed to send ping: gatewayId={}, connectionId={}, error={}",
                            conn.getGatewayId(), conn.getConnectionId(), e.getMessage());
                    unregister(conn.getGatewayId(), conn.getConnectionId());
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void closeQuietly(GatewayConnection conn, int code, String reason) {
        try {
            conn.close(code, reason);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to close connection: gatewayId={}, connectionId={}, error={}",
                    conn.getGatewayId(), conn.getConnectionId(), e.getMessage());
        }
    }
}
