package com.relay.control;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

@Slf4j
public class CircuitBreakerRegistry {

    private final Map<String, CircuitBreaker> breakers = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final CircuitBreakerSettings defaultSettings;
    private final Map<String, CircuitBreakerSettings> serviceSettings;
    private final CircuitStateListener listener;
    private final Clock clock;

    public CircuitBreakerRegistry(CircuitBreakerSettings defaultSettings) {
        this(defaultSettings, Map.of(), null, Clock.systemUTC());
    }

    public CircuitBreakerRegistry(CircuitBreakerSettings defaultSettings,
                                  Map<String, CircuitBreakerSettings> serviceSettings,
                                  CircuitStateListener listener,
                                  Clock clock) {
        this.defaultSettings = defaultSettings;
        this.serviceSettings = Map.copyOf(serviceSettings);
        this.listener = listener;
        this.clock = clock;
    }

    public CircuitBreaker get(String serviceName) {
        lock.readLock().lock();
        try {
            CircuitBreaker existing = breakers.get(serviceName);
            if (existing != null) {
                return existing;
            }
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            CircuitBreaker existing = breakers.get(serviceName);
            if (existing != null) {
                return existing;
            }

            CircuitBreakerSettings settings = serviceSettings.getOrDefault(serviceName, defaultSettings);
            CircuitBreaker breaker = new CircuitBreaker(serviceName, settings, listener, clock);
            breakers.put(serviceName, breaker);
            log.info("Created circuit breaker for service: {} ({})", serviceName, breaker.getSettings());
            return breaker;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<CircuitBreaker> find(String serviceName) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(breakers.get(serviceName));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<CircuitBreaker> getAll() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(breakers.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return breakers.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
