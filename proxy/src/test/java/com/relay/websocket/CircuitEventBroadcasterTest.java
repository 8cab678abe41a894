package com.relay.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relay.model.CircuitState;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CircuitEventBroadcasterTest {

    private final CircuitEventWebSocketHandler handler = new CircuitEventWebSocketHandler(new ObjectMapper());
    private final CircuitEventBroadcaster broadcaster = new CircuitEventBroadcaster(handler);

    @Test
    void sendsTransitionToOpenSessions() throws Exception {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.isOpen()).thenReturn(true);
        handler.afterConnectionEstablished(session);

        broadcaster.onStateChange("orders", CircuitState.CLOSED, CircuitState.OPEN);

        ArgumentCaptor<TextMessage> message = ArgumentCaptor.forClass(TextMessage.class);
        verify(session).sendMessage(message.capture());
        assertThat(message.getValue().getPayload())
                .contains("\"service\":\"orders\"")
                .contains("\"from\":\"CLOSED\"")
                .contains("\"to\":\"OPEN\"");
    }

    @Test
    void closedSessionsStopReceiving() throws Exception {
        WebSocketSession session = mock(WebSocketSession.class);
        handler.afterConnectionEstablished(session);
        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        broadcaster.onStateChange("orders", CircuitState.OPEN, CircuitState.HALF_OPEN);

        verify(session, never()).sendMessage(any());
        assertThat(handler.getActiveConnections()).isZero();
    }
}
