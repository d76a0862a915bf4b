package com.salesanalytics.websocket;

import com.salesanalytics.exception.UnauthorizedException;
import com.salesanalytics.ledger.CallLedger;
import com.salesanalytics.security.Identity;
import com.salesanalytics.security.IdentityVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriTemplate;

import java.util.Map;

/**
 * Authenticates the stream handshake before the connection is upgraded.
 *
 * The token travels as the {@code token} query parameter because browsers cannot
 * set headers on WebSocket requests. Rejections are plain HTTP responses:
 * - 401 for a missing or invalid token
 * - 404 for a call the ledger does not know
 *
 * On success the verified identity and the call id are stored as session attributes
 * for {@link SentimentWebSocketHandler}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TokenHandshakeInterceptor implements HandshakeInterceptor {

    public static final String ENDPOINT = "/ws/sentiment/{callId}";
    public static final String IDENTITY_ATTRIBUTE = "identity";
    public static final String CALL_ID_ATTRIBUTE = "callId";

    private static final UriTemplate ENDPOINT_TEMPLATE = new UriTemplate(ENDPOINT);

    private final IdentityVerifier identityVerifier;
    private final CallLedger callLedger;

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        String path = request.getURI().getPath();
        String callId = ENDPOINT_TEMPLATE.matches(path) ? ENDPOINT_TEMPLATE.match(path).get("callId") : null;
        if (callId == null || callId.isBlank()) {
            log.warn("Rejected stream handshake: no call id in {}", path);
            response.setStatusCode(HttpStatus.NOT_FOUND);
            return false;
        }

        String token = UriComponentsBuilder.fromUri(request.getURI()).build()
                .getQueryParams().getFirst("token");

        Identity identity;
        try {
            identity = identityVerifier.verify(token);
        } catch (UnauthorizedException e) {
            log.warn("Rejected stream handshake for call {}: {}", callId, e.getMessage());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }

        if (!callLedger.exists(callId)) {
            log.warn("Rejected stream handshake by {}: call {} not found", identity.subject(), callId);
            response.setStatusCode(HttpStatus.NOT_FOUND);
            return false;
        }

        attributes.put(IDENTITY_ATTRIBUTE, identity);
        attributes.put(CALL_ID_ATTRIBUTE, callId);
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        if (exception != null) {
            log.warn("Stream handshake failed for {}: {}", request.getURI().getPath(), exception.getMessage());
        }
    }
}
