package com.example.gatewaymanager.gateway;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sliding-window limiter for WebSocket connection attempts, keyed by source
 * address. Each address keeps the timestamps of its attempts inside the
 * window; older ones are pruned on every check. Addresses that stay quiet for
 * a whole window are evicted from the cache.
 */
public class ConnectionRateLimiter {

    private final int attemptsPerWindow;
    private final Duration window;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Cache<String, Deque<Instant>> attempts;

    public ConnectionRateLimiter(int attemptsPerWindow, Duration window, Clock clock) {
        this.attemptsPerWindow = attemptsPerWindow;
        this.window = window;
        this.clock = clock;
        this.attempts = Caffeine.newBuilder()
                .expireAfterAccess(window)
                .build();
    }

    public ConnectionRateLimiter(int attemptsPerWindow) {
        this(attemptsPerWindow, Duration.ofMinutes(1), Clock.systemUTC());
    }

    /**
     * Record an attempt from the given address.
     *
     * @return false if the address has used its budget for the current window
     */
    public boolean tryAcquire(String address) {
        lock.lock();
        try {
            Instant now = clock.instant();
            Instant windowStart = now.minus(window);
            Deque<Instant> recent = attempts.get(address, k -> new ArrayDeque<>());

            while (!recent.isEmpty() && !recent.peekFirst().isAfter(windowStart)) {
                recent.pollFirst();
            }
            if (recent.size() >= attemptsPerWindow) {
                return false;
            }
            recent.addLast(now);
            return true;
        } finally {
            lock.unlock();
        }
    }
}
