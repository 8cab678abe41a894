package com.relay.exception;

import lombok.Getter;

@Getter
public class RetryExhaustedException extends RelayException {

    private final int attempts;

    public RetryExhaustedException(int attempts, Throwable lastFailure) {
        super("Max retry attempts (" + attempts + ") exceeded: " + lastFailure.getMessage(), lastFailure);
        this.attempts = attempts;
    }
}
