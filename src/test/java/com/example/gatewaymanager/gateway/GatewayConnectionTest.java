package com.example.gatewaymanager.gateway;

import com.example.gatewaymanager.exception.ConnectionClosedException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GatewayConnectionTest {

    @Test
    void sendDelegatesToTransportWithoutTouchingStats() throws IOException {
        FakeTransport transport = new FakeTransport();
        GatewayConnection conn = new GatewayConnection("gw-1", "c-1", transport, "key");

        conn.send("hello".getBytes(StandardCharsets.UTF_8));

        assertEquals(1, transport.sent.size());
        assertEquals(0, conn.getStats().totalSent());
        assertEquals(0, conn.getStats().failedDeliveries());
    }

    @Test
    void sendAfterCloseIsRejected() throws IOException {
        FakeTransport transport = new FakeTransport();
        GatewayConnection conn = new GatewayConnection("gw-1", "c-1", transport, "key");
        conn.close(1000, "normal closure");

        assertThrows(ConnectionClosedException.class, () -> conn.send(new byte[]{1}));
        assertTrue(transport.sent.isEmpty());
    }

    @Test
    void closeIsIdempotent() throws IOException {
        FakeTransport transport = new FakeTransport();
        GatewayConnection conn = new GatewayConnection("gw-1", "c-1", transport, "key");

        conn.close(1000, "normal closure");
        conn.close(1001, "server shutdown");

        assertTrue(conn.isClosed());
        assertEquals(1, transport.closeCount.get());
        assertEquals(1000, transport.lastCloseCode);
    }

    @Test
    void updateHeartbeatAdvancesLastHeartbeat() throws InterruptedException {
        GatewayConnection conn = new GatewayConnection("gw-1", "c-1", new FakeTransport(), "key");
        Instant initial = conn.getLastHeartbeat();
        assertEquals(conn.getConnectedAt(), initial);

        Thread.sleep(5);
        conn.updateHeartbeat();

        assertTrue(conn.getLastHeartbeat().isAfter(initial));
    }

    @Test
    void connectionInfoDescribesConnection() {
        GatewayConnection conn = new GatewayConnection("gw-1", "c-1", new FakeTransport(), "secret");

        Map<String, Object> info = conn.getConnectionInfo();

        assertEquals("gw-1", info.get("gatewayId"));
        assertEquals("c-1", info.get("connectionId"));
        assertEquals(false, info.get("closed"));
        assertFalse(info.containsValue("secret"));
    }
}
