package com.relay.exception;

import com.relay.model.CircuitState;

public class CircuitOpenException extends CircuitBreakerRejectedException {

    public CircuitOpenException(String serviceName) {
        super(serviceName, CircuitState.OPEN, "Circuit breaker is open for " + serviceName);
    }
}
