package com.relay.websocket;

import com.relay.control.CircuitStateListener;
import com.relay.model.CircuitEvent;
import com.relay.model.CircuitState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class CircuitEventBroadcaster implements CircuitStateListener {

    private final CircuitEventWebSocketHandler webSocketHandler;

    @Override
    public void onStateChange(String serviceName, CircuitState from, CircuitState to) {
        webSocketHandler.broadcast(CircuitEvent.builder()
                .timestamp(System.currentTimeMillis())
                .service(serviceName)
                .from(from)
                .to(to)
                .build());
    }
}
