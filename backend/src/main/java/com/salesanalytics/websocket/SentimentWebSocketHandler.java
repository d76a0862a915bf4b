package com.salesanalytics.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesanalytics.exception.AnalyticsException;
import com.salesanalytics.security.Identity;
import com.salesanalytics.streaming.StreamConnection;
import com.salesanalytics.streaming.StreamController;
import com.salesanalytics.streaming.StreamMessage;
import com.salesanalytics.streaming.StreamSession;
import com.salesanalytics.streaming.StreamingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket endpoint of the live sentiment stream.
 *
 * Each connection is one stream session. Inbound frames are commands handled on the
 * container's thread; outbound samples are pushed by the stream scheduler through the
 * session decorator, so a slow client never blocks command handling.
 *
 * Connection Flow:
 * 1. Handshake authenticated by {@link TokenHandshakeInterceptor}
 * 2. Session admitted by the stream controller; a rejected admission gets an
 *    {@code error} message and a policy-violation close
 * 3. Text frames {@code {"type": "..."}} are dispatched as commands
 * 4. Closing the socket removes the session immediately
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SentimentWebSocketHandler extends TextWebSocketHandler {

    private final StreamController streamController;
    private final StreamingProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * WebSocket session id to stream session id.
     */
    private final Map<String, String> streamSessions = new ConcurrentHashMap<>();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        Identity identity = (Identity) session.getAttributes().get(TokenHandshakeInterceptor.IDENTITY_ATTRIBUTE);
        String callId = (String) session.getAttributes().get(TokenHandshakeInterceptor.CALL_ID_ATTRIBUTE);

        WebSocketSession concurrent = new ConcurrentWebSocketSessionDecorator(
                session,
                (int) properties.getSendTimeLimit().toMillis(),
                properties.getSendBufferLimit());
        StreamConnection connection = new WebSocketStreamConnection(concurrent, objectMapper);

        try {
            StreamSession streamSession = streamController.subscribe(callId, identity, connection);
            streamSessions.put(session.getId(), streamSession.getId());
            if (!session.isOpen()) {
                // closed while subscribing; the close callback may have missed the mapping
                afterConnectionClosed(session, CloseStatus.NORMAL);
            }
        } catch (AnalyticsException e) {
            log.warn("Stream admission rejected for call {}: {}", callId, e.getMessage());
            try {
                connection.send(StreamMessage.error(e));
            } catch (IOException sendError) {
                log.debug("Could not report admission failure on {}: {}", session.getId(), sendError.getMessage());
            }
            connection.close(StreamConnection.CloseCode.POLICY_VIOLATION);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String streamSessionId = streamSessions.get(session.getId());
        if (streamSessionId == null) {
            log.debug("Ignoring message on unadmitted WebSocket session {}", session.getId());
            return;
        }
        streamController.handleCommand(streamSessionId, commandType(message.getPayload()));
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on WebSocket session {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String streamSessionId = streamSessions.remove(session.getId());
        if (streamSessionId != null) {
            log.debug("WebSocket session {} closed ({})", session.getId(), status);
            streamController.unsubscribe(streamSessionId);
        }
    }

    /**
     * The {@code type} of a command frame, or null if the frame is not a JSON object with a string type.
     */
    String commandType(String payload) {
        try {
            JsonNode node = objectMapper.readTree(payload);
            if (node != null && node.isObject() && node.path("type").isTextual()) {
                return node.get("type").asText();
            }
            return null;
        } catch (JsonProcessingException e) {
            log.debug("Unparseable stream command: {}", e.getOriginalMessage());
            return null;
        }
    }
}
