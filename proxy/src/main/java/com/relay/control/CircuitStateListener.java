package com.relay.control;

import com.relay.model.CircuitState;

@FunctionalInterface
public interface CircuitStateListener {

    void onStateChange(String serviceName, CircuitState from, CircuitState to);
}
