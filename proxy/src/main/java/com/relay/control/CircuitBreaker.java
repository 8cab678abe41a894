package com.relay.control;

import com.relay.exception.CircuitOpenException;
import com.relay.exception.ProbeLimitExceededException;
import com.relay.model.CircuitState;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Counters belong to a generation. Outcomes of calls admitted under an older generation are dropped.
 */
@Slf4j
public class CircuitBreaker {

    private final String name;
    private final CircuitBreakerSettings settings;
    private final CircuitStateListener listener;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<Transition> pendingTransitions = new ArrayList<>();

    private CircuitState state = CircuitState.CLOSED;
    private long generation;
    private Instant expiry;

    private long requests;
    private long totalSuccesses;
    private long totalFailures;
    private long consecutiveSuccesses;
    private long consecutiveFailures;

    public CircuitBreaker(String name, CircuitBreakerSettings settings) {
        this(name, settings, null, Clock.systemUTC());
    }

    public CircuitBreaker(String name, CircuitBreakerSettings settings,
                          CircuitStateListener listener, Clock clock) {
        this.name = name;
        this.settings = settings.withDefaults();
        this.listener = listener;
        this.clock = clock;
        toNewGeneration(clock.instant());
    }

    public <T> T execute(Callable<T> fn) throws Exception {
        long admittedGeneration = beforeRequest();

        boolean success = false;
        try {
            T result = fn.call();
            success = true;
            return result;
        } finally {
            afterRequest(admittedGeneration, success);
        }
    }

    private long beforeRequest() {
        lock.lock();
        try {
            CircuitState current = currentState(clock.instant());

            if (current == CircuitState.OPEN) {
                throw new CircuitOpenException(name);
            }

            if (current == CircuitState.HALF_OPEN && requests >= settings.getMaxHalfOpenProbes()) {
                throw new ProbeLimitExceededException(name, settings.getMaxHalfOpenProbes());
            }

            requests++;
            return generation;
        } finally {
            lock.unlock();
            firePendingTransitions();
        }
    }

    private void afterRequest(long admittedGeneration, boolean success) {
        lock.lock();
        try {
            Instant now = clock.instant();
            CircuitState current = currentState(now);

            if (admittedGeneration != generation) {
                return;
            }

            if (success) {
                onSuccess(current, now);
            } else {
                onFailure(current, now);
            }
        } finally {
            lock.unlock();
            firePendingTransitions();
        }
    }

    private void onSuccess(CircuitState current, Instant now) {
        totalSuccesses++;
        consecutiveSuccesses++;
        consecutiveFailures = 0;

        if (current == CircuitState.HALF_OPEN && consecutiveSuccesses >= settings.getMaxHalfOpenProbes()) {
            setState(CircuitState.CLOSED, now);
        }
    }

    private void onFailure(CircuitState current, Instant now) {
        totalFailures++;
        consecutiveFailures++;
        consecutiveSuccesses = 0;

        switch (current) {
            case CLOSED -> {
                if (shouldOpen()) {
                    setState(CircuitState.OPEN, now);
                }
            }
            case HALF_OPEN -> setState(CircuitState.OPEN, now);
            default -> {
            }
        }
    }

    private boolean shouldOpen() {
        if (requests < settings.getMinRequestThreshold()) {
            return false;
        }
        double failureRate = (double) totalFailures / requests;
        return failureRate >= settings.getFailureRateThreshold();
    }

    // caller holds the lock
    private CircuitState currentState(Instant now) {
        switch (state) {
            case CLOSED -> {
                if (expiry != null && now.isAfter(expiry)) {
                    toNewGeneration(now);
                }
            }
            case OPEN -> {
                if (!now.isBefore(expiry)) {
                    setState(CircuitState.HALF_OPEN, now);
                }
            }
            default -> {
            }
        }
        return state;
    }

    // caller holds the lock
    private void setState(CircuitState newState, Instant now) {
        if (state == newState) {
            return;
        }

        CircuitState previous = state;
        state = newState;
        toNewGeneration(now);

        pendingTransitions.add(new Transition(previous, newState));
    }

    // caller holds the lock
    private void toNewGeneration(Instant now) {
        generation++;
        requests = 0;
        totalSuccesses = 0;
        totalFailures = 0;
        consecutiveSuccesses = 0;
        consecutiveFailures = 0;

        expiry = switch (state) {
            case CLOSED -> now.plus(settings.getClosedWindow());
            case OPEN -> now.plus(settings.getOpenTimeout());
            case HALF_OPEN -> null;
        };
    }

    private void firePendingTransitions() {
        List<Transition> fired;
        lock.lock();
        try {
            if (pendingTransitions.isEmpty()) {
                return;
            }
            fired = new ArrayList<>(pendingTransitions);
            pendingTransitions.clear();
        } finally {
            lock.unlock();
        }

        for (Transition transition : fired) {
            log.info("Circuit breaker transition: service={}, {} -> {}",
                    name, transition.from(), transition.to());

            if (listener == null) {
                continue;
            }
            try {
                listener.onStateChange(name, transition.from(), transition.to());
            } catch (RuntimeException e) {
                log.warn("Circuit state listener failed for {}: {}", name, e.getMessage());
            }
        }
    }

    public CircuitState getState() {
        lock.lock();
        try {
            return currentState(clock.instant());
        } finally {
            lock.unlock();
            firePendingTransitions();
        }
    }

    public CircuitCounts getCounts() {
        lock.lock();
        try {
            currentState(clock.instant());
            return new CircuitCounts(requests, totalSuccesses, totalFailures,
                    consecutiveSuccesses, consecutiveFailures);
        } finally {
            lock.unlock();
            firePendingTransitions();
        }
    }

    public long getGeneration() {
        lock.lock();
        try {
            currentState(clock.instant());
            return generation;
        } finally {
            lock.unlock();
            firePendingTransitions();
        }
    }

    public void reset() {
        lock.lock();
        try {
            Instant now = clock.instant();
            if (state == CircuitState.CLOSED) {
                toNewGeneration(now);
            } else {
                setState(CircuitState.CLOSED, now);
            }
        } finally {
            lock.unlock();
            firePendingTransitions();
        }
    }

    public String getName() {
        return name;
    }

    public CircuitBreakerSettings getSettings() {
        return settings;
    }

    @Override
    public String toString() {
        lock.lock();
        try {
            return String.format("CircuitBreaker{name=%s, state=%s, requests=%d, successes=%d, failures=%d}",
                    name, state, requests, totalSuccesses, totalFailures);
        } finally {
            lock.unlock();
        }
    }

    private record Transition(CircuitState from, CircuitState to) {}
}
