package com.relay.control;

public record CircuitCounts(
        long requests,
        long totalSuccesses,
        long totalFailures,
        long consecutiveSuccesses,
        long consecutiveFailures
) {

    public static final CircuitCounts EMPTY = new CircuitCounts(0, 0, 0, 0, 0);

    public double failureRate() {
        return requests == 0 ? 0.0 : (double) totalFailures / requests;
    }
}
