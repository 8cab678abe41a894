package com.relay.exception;

import com.relay.model.CircuitState;

public class ProbeLimitExceededException extends CircuitBreakerRejectedException {

    public ProbeLimitExceededException(String serviceName, int maxProbes) {
        super(serviceName, CircuitState.HALF_OPEN,
                "Too many probe requests for " + serviceName + " (max " + maxProbes + ")");
    }
}
