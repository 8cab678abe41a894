package com.relay.control;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder(toBuilder = true)
public class CircuitBreakerSettings {

    static final int DEFAULT_MAX_HALF_OPEN_PROBES = 1;
    static final Duration DEFAULT_CLOSED_WINDOW = Duration.ofSeconds(60);
    static final Duration DEFAULT_OPEN_TIMEOUT = Duration.ofSeconds(60);
    static final int DEFAULT_MIN_REQUEST_THRESHOLD = 5;
    static final double DEFAULT_FAILURE_RATE_THRESHOLD = 0.5;

    int maxHalfOpenProbes;
    Duration closedWindow;
    Duration openTimeout;
    int minRequestThreshold;
    double failureRateThreshold;

    public static CircuitBreakerSettings defaults() {
        return CircuitBreakerSettings.builder().build().withDefaults();
    }

    public CircuitBreakerSettings withDefaults() {
        return CircuitBreakerSettings.builder()
                .maxHalfOpenProbes(maxHalfOpenProbes > 0 ? maxHalfOpenProbes : DEFAULT_MAX_HALF_OPEN_PROBES)
                .closedWindow(isPositive(closedWindow) ? closedWindow : DEFAULT_CLOSED_WINDOW)
                .openTimeout(isPositive(openTimeout) ? openTimeout : DEFAULT_OPEN_TIMEOUT)
                .minRequestThreshold(minRequestThreshold > 0 ? minRequestThreshold : DEFAULT_MIN_REQUEST_THRESHOLD)
                .failureRateThreshold(failureRateThreshold > 0 ? failureRateThreshold : DEFAULT_FAILURE_RATE_THRESHOLD)
                .build();
    }

    private static boolean isPositive(Duration duration) {
        return duration != null && !duration.isNegative() && !duration.isZero();
    }
}
