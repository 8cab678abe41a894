package com.relay.model;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
