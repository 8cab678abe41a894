package com.relay.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relay.model.CircuitEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.concurrent.CopyOnWriteArrayList;

@Slf4j
@Component
@RequiredArgsConstructor
public class CircuitEventWebSocketHandler extends TextWebSocketHandler {

    private final ObjectMapper objectMapper;
    private final CopyOnWriteArrayList<WebSocketSession> sessions = new CopyOnWriteArrayList<>();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        sessions.add(session);
        log.info("Circuit event subscriber connected: {}", session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session);
        log.info("Circuit event subscriber disconnected: {}, status: {}", session.getId(), status);
    }

    public void broadcast(CircuitEvent event) {
        if (sessions.isEmpty()) {
            return;
        }

        try {
            TextMessage message = new TextMessage(objectMapper.writeValueAsString(event));

            sessions.forEach(session -> {
                try {
                    if (session.isOpen()) {
                        // sessions are not thread-safe for concurrent sends
                        synchronized (session) {
                            session.sendMessage(message);
                        }
                    }
                } catch (IOException e) {
                    log.error("Failed to send circuit event to session: {}", session.getId(), e);
                }
            });
        } catch (IOException e) {
            log.error("Failed to serialize circuit event", e);
        }
    }

    public int getActiveConnections() {
        return sessions.size();
    }
}
