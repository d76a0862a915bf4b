package com.salesanalytics.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesanalytics.exception.CallNotFoundException;
import com.salesanalytics.security.Identity;
import com.salesanalytics.security.Role;
import com.salesanalytics.streaming.StreamConnection;
import com.salesanalytics.streaming.StreamController;
import com.salesanalytics.streaming.StreamSession;
import com.salesanalytics.streaming.StreamingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SentimentWebSocketHandler Unit Tests")
class SentimentWebSocketHandlerTest {

    private static final Identity ALICE = new Identity("alice", Role.AGENT);

    @Mock
    private StreamController streamController;

    @Mock
    private WebSocketSession webSocketSession;

    private SentimentWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        handler = new SentimentWebSocketHandler(streamController, new StreamingProperties(), new ObjectMapper());

        Map<String, Object> attributes = new HashMap<>();
        attributes.put(TokenHandshakeInterceptor.IDENTITY_ATTRIBUTE, ALICE);
        attributes.put(TokenHandshakeInterceptor.CALL_ID_ATTRIBUTE, "call-1");
        lenient().when(webSocketSession.getAttributes()).thenReturn(attributes);
        lenient().when(webSocketSession.getId()).thenReturn("ws-1");
        lenient().when(webSocketSession.isOpen()).thenReturn(true);
    }

    private StreamSession admit() {
        StreamSession session = new StreamSession("call-1", ALICE, mock(StreamConnection.class), Instant.now());
        when(streamController.subscribe(eq("call-1"), eq(ALICE), any(StreamConnection.class))).thenReturn(session);
        handler.afterConnectionEstablished(webSocketSession);
        return session;
    }

    @Test
    @DisplayName("established connection should subscribe with the handshake identity")
    void testAfterConnectionEstablished_Subscribes() {
        // Act
        admit();

        // Assert
        verify(streamController).subscribe(eq("call-1"), eq(ALICE), any(StreamConnection.class));
    }

    @Test
    @DisplayName("rejected admission should send an error and close with policy violation")
    void testAfterConnectionEstablished_Rejected() throws Exception {
        // Arrange
        when(streamController.subscribe(anyString(), any(), any()))
                .thenThrow(CallNotFoundException.forCall("call-1"));

        // Act
        handler.afterConnectionEstablished(webSocketSession);

        // Assert
        ArgumentCaptor<TextMessage> sent = ArgumentCaptor.forClass(TextMessage.class);
        verify(webSocketSession).sendMessage(sent.capture());
        assertTrue(sent.getValue().getPayload().contains("\"type\":\"error\""));
        assertTrue(sent.getValue().getPayload().contains("\"code\":\"NOT_FOUND\""));
        verify(webSocketSession).close(CloseStatus.POLICY_VIOLATION);
    }

    @Test
    @DisplayName("text frames should be dispatched as commands of the admitted session")
    void testHandleTextMessage_DispatchesCommand() {
        // Arrange
        StreamSession session = admit();

        // Act
        handler.handleTextMessage(webSocketSession, new TextMessage("{\"type\":\"ping\"}"));
        handler.handleTextMessage(webSocketSession, new TextMessage("not json"));

        // Assert
        verify(streamController).handleCommand(session.getId(), "ping");
        verify(streamController).handleCommand(session.getId(), null);
    }

    @Test
    @DisplayName("closing the socket should unsubscribe exactly once")
    void testAfterConnectionClosed_Unsubscribes() {
        // Arrange
        StreamSession session = admit();

        // Act
        handler.afterConnectionClosed(webSocketSession, CloseStatus.NORMAL);
        handler.afterConnectionClosed(webSocketSession, CloseStatus.NORMAL);

        // Assert
        verify(streamController, times(1)).unsubscribe(session.getId());
    }

    @Test
    @DisplayName("commandType should only accept objects with a string type")
    void testCommandType() {
        assertEquals("get_history", handler.commandType("{\"type\":\"get_history\",\"extra\":1}"));
        assertNull(handler.commandType("{\"type\":5}"));
        assertNull(handler.commandType("[\"ping\"]"));
        assertNull(handler.commandType("{}"));
        assertNull(handler.commandType("{broken"));
    }
}
