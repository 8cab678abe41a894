package com.relay.control;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

@Slf4j
public class RateLimiter implements AutoCloseable {

    public static final Duration DEFAULT_CLEANUP_INTERVAL = Duration.ofMinutes(5);

    private final int ratePerMinute;
    private final int burst;
    private final Duration cleanupInterval;
    private final Clock clock;

    private final Map<String, Visitor> visitors = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final ScheduledExecutorService sweeper;

    public RateLimiter(int ratePerMinute, int burst) {
        this(ratePerMinute, burst, DEFAULT_CLEANUP_INTERVAL, Clock.systemUTC(), true);
    }

    public RateLimiter(int ratePerMinute, int burst, Duration cleanupInterval, Clock clock, boolean sweepEnabled) {
        if (ratePerMinute <= 0 || burst <= 0) {
            throw new IllegalArgumentException("ratePerMinute and burst must be positive");
        }
        this.ratePerMinute = ratePerMinute;
        this.burst = burst;
        this.cleanupInterval = cleanupInterval;
        this.clock = clock;

        if (sweepEnabled) {
            this.sweeper = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "rate-limiter-sweep");
                thread.setDaemon(true);
                return thread;
            });
            long periodMs = cleanupInterval.toMillis();
            sweeper.scheduleWithFixedDelay(this::sweepSafely, periodMs, periodMs, TimeUnit.MILLISECONDS);
        } else {
            this.sweeper = null;
        }
    }

    public boolean allow(String key) {
        Visitor visitor = getOrCreateVisitor(key);
        return visitor.tryConsume(clock.instant(), ratePerMinute / 60.0, burst);
    }

    private Visitor getOrCreateVisitor(String key) {
        lock.readLock().lock();
        try {
            Visitor existing = visitors.get(key);
            if (existing != null) {
                return existing;
            }
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            return visitors.computeIfAbsent(key, k -> new Visitor(k, burst, clock.instant()));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int sweep() {
        List<String> keys;
        lock.readLock().lock();
        try {
            keys = new ArrayList<>(visitors.keySet());
        } finally {
            lock.readLock().unlock();
        }

        Instant cutoff = clock.instant().minus(cleanupInterval);
        int removed = 0;

        for (String key : keys) {
            lock.writeLock().lock();
            try {
                Visitor visitor = visitors.get(key);
                if (visitor != null && visitor.isIdleSince(cutoff)) {
                    visitors.remove(key);
                    removed++;
                }
            } finally {
                lock.writeLock().unlock();
            }
        }

        if (removed > 0) {
            log.debug("Removed {} idle rate limit visitors", removed);
        }
        return removed;
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("Rate limiter sweep failed", e);
        }
    }

    public Optional<Visitor> getVisitor(String key) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(visitors.get(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int visitorCount() {
        lock.readLock().lock();
        try {
            return visitors.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getRatePerMinute() {
        return ratePerMinute;
    }

    public int getBurst() {
        return burst;
    }

    @Override
    public void close() {
        if (sweeper != null) {
            sweeper.shutdownNow();
        }
    }
}
