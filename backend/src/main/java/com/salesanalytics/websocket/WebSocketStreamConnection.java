package com.salesanalytics.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesanalytics.streaming.StreamConnection;
import com.salesanalytics.streaming.StreamMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * {@link StreamConnection} over a WebSocket session; messages go out as JSON text frames.
 *
 * The session should be a {@link org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator}
 * since ticks and command replies may send from different threads.
 */
@Slf4j
public class WebSocketStreamConnection implements StreamConnection {

    private final WebSocketSession session;
    private final ObjectMapper objectMapper;

    public WebSocketStreamConnection(WebSocketSession session, ObjectMapper objectMapper) {
        this.session = session;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public void send(StreamMessage message) throws IOException {
        session.sendMessage(new TextMessage(objectMapper.writeValueAsString(message)));
    }

    @Override
    public void close(CloseCode code) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(toCloseStatus(code));
        } catch (IOException e) {
            log.debug("Error closing WebSocket session {}: {}", session.getId(), e.getMessage());
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    static CloseStatus toCloseStatus(CloseCode code) {
        return switch (code) {
            case NORMAL -> CloseStatus.NORMAL;
            case POLICY_VIOLATION -> CloseStatus.POLICY_VIOLATION;
            case GOING_AWAY -> CloseStatus.GOING_AWAY;
        };
    }
}
