package com.relay.control;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

@Slf4j
public class EndpointRateLimiterRegistry implements AutoCloseable {

    private final RateLimiter defaultLimiter;
    private final Map<String, RateLimiter> overrides = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final Duration cleanupInterval;
    private final Clock clock;
    private final boolean sweepEnabled;

    public EndpointRateLimiterRegistry(int defaultRatePerMinute, int defaultBurst) {
        this(defaultRatePerMinute, defaultBurst, RateLimiter.DEFAULT_CLEANUP_INTERVAL, Clock.systemUTC(), true);
    }

    public EndpointRateLimiterRegistry(int defaultRatePerMinute, int defaultBurst,
                                       Duration cleanupInterval, Clock clock, boolean sweepEnabled) {
        this.cleanupInterval = cleanupInterval;
        this.clock = clock;
        this.sweepEnabled = sweepEnabled;
        this.defaultLimiter = newLimiter(defaultRatePerMinute, defaultBurst);
    }

    public void addEndpoint(String pathPrefix, int ratePerMinute, int burst) {
        String prefix = PathPrefixes.normalize(pathPrefix);
        RateLimiter limiter = newLimiter(ratePerMinute, burst);

        RateLimiter replaced;
        lock.writeLock().lock();
        try {
            replaced = overrides.put(prefix, limiter);
        } finally {
            lock.writeLock().unlock();
        }

        if (replaced != null) {
            replaced.close();
        }
        log.info("Registered rate limit override: {} -> {}/min, burst {}", prefix, ratePerMinute, burst);
    }

    public RateLimiter resolve(String path) {
        lock.readLock().lock();
        try {
            RateLimiter best = null;
            int bestLength = -1;
            for (Map.Entry<String, RateLimiter> entry : overrides.entrySet()) {
                String prefix = entry.getKey();
                if (prefix.length() > bestLength && PathPrefixes.matches(prefix, path)) {
                    best = entry.getValue();
                    bestLength = prefix.length();
                }
            }
            return best != null ? best : defaultLimiter;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean allow(String path, String clientKey) {
        return resolve(path).allow(clientKey);
    }

    public RateLimiter getDefaultLimiter() {
        return defaultLimiter;
    }

    private RateLimiter newLimiter(int ratePerMinute, int burst) {
        return new RateLimiter(ratePerMinute, burst, cleanupInterval, clock, sweepEnabled);
    }

    @Override
    public void close() {
        List<RateLimiter> limiters;
        lock.readLock().lock();
        try {
            limiters = new ArrayList<>(overrides.values());
        } finally {
            lock.readLock().unlock();
        }
        limiters.forEach(RateLimiter::close);
        defaultLimiter.close();
    }
}
