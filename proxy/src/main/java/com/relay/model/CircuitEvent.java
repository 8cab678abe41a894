package com.relay.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CircuitEvent {
    long timestamp;
    String service;
    CircuitState from;
    CircuitState to;
}
