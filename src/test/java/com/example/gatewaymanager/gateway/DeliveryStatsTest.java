package com.example.gatewaymanager.gateway;

import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DeliveryStatsTest {

    @Test
    void recordsMostRecentFailure() {
        DeliveryStats stats = new DeliveryStats();
        assertNull(stats.getLastFailure().reason());

        stats.incrementFailed("send error: first");
        stats.incrementFailed("send error: second");

        DeliveryStats.Snapshot snapshot = stats.snapshot();
        assertEquals(2, snapshot.failedDeliveries());
        assertEquals("send error: second", snapshot.lastFailureReason());
        assertNotNull(snapshot.lastFailureTime());
    }

    @Test
    void countersAreSafeUnderConcurrentIncrements() throws InterruptedException {
        DeliveryStats stats = new DeliveryStats();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        for (int i = 0; i < 8; i++) {
            pool.execute(() -> {
                for (int j = 0; j < 1000; j++) {
                    stats.incrementTotalSent();
                    stats.incrementFailed("send error");
                }
            });
        }
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(8000, stats.getTotalSent());
        assertEquals(8000, stats.getFailedDeliveries());
    }
}
