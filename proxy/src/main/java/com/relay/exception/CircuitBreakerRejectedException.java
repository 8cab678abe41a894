package com.relay.exception;

import com.relay.model.CircuitState;
import lombok.Getter;

@Getter
public abstract class CircuitBreakerRejectedException extends RelayException {

    private final String serviceName;
    private final CircuitState state;

    protected CircuitBreakerRejectedException(String serviceName, CircuitState state, String message) {
        super(message);
        this.serviceName = serviceName;
        this.state = state;
    }
}
