package com.example.gatewaymanager.gateway;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Per-connection delivery counters. The counters are lock-free; the last
 * failure time and reason form one compound value and share a lock.
 */
public class DeliveryStats {

    private final AtomicLong totalSent = new AtomicLong();
    private final AtomicLong failedDeliveries = new AtomicLong();
    private final ReadWriteLock failureLock = new ReentrantReadWriteLock();
    private Instant lastFailureTime;
    private String lastFailureReason;

    public void incrementTotalSent() {
        totalSent.incrementAndGet();
    }

    public void incrementFailed(String reason) {
        failedDeliveries.incrementAndGet();
        failureLock.writeLock().lock();
        try {
            lastFailureTime = Instant.now();
            lastFailureReason = reason;
        } finally {
            failureLock.writeLock().unlock();
        }
    }

    public long getTotalSent() {
        return totalSent.get();
    }

    public long getFailedDeliveries() {
        return failedDeliveries.get();
    }

    public LastFailure getLastFailure() {
        failureLock.readLock().lock();
        try {
            return new LastFailure(lastFailureTime, lastFailureReason);
        } finally {
            failureLock.readLock().unlock();
        }
    }

    public Snapshot snapshot() {
        LastFailure failure = getLastFailure();
        return new Snapshot(getTotalSent(), getFailedDeliveries(), failure.time(), failure.reason());
    }

    public record LastFailure(Instant time, String reason) {}

    public record Snapshot(long totalSent, long failedDeliveries, Instant lastFailureTime, String lastFailureReason) {}
}
