package com.relay.control;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

public final class Visitor {

    private final String key;
    private final ReentrantLock lock = new ReentrantLock();
    private double tokens;
    private Instant lastRefill;

    Visitor(String key, double tokens, Instant lastRefill) {
        this.key = key;
        this.tokens = tokens;
        this.lastRefill = lastRefill;
    }

    boolean tryConsume(Instant now, double tokensPerSecond, double capacity) {
        lock.lock();
        try {
            double elapsedSeconds = Math.max(0, Duration.between(lastRefill, now).toNanos()) / 1_000_000_000.0;
            lastRefill = now;

            tokens = Math.min(capacity, tokens + elapsedSeconds * tokensPerSecond);

            if (tokens >= 1.0) {
                tokens -= 1.0;
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    boolean isIdleSince(Instant cutoff) {
        lock.lock();
        try {
            return lastRefill.isBefore(cutoff);
        } finally {
            lock.unlock();
        }
    }

    public String getKey() {
        return key;
    }

    public double getTokens() {
        lock.lock();
        try {
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    public Instant getLastRefill() {
        lock.lock();
        try {
            return lastRefill;
        } finally {
            lock.unlock();
        }
    }
}
