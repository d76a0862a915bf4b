package com.salesanalytics.config;

import com.salesanalytics.websocket.SentimentWebSocketHandler;
import com.salesanalytics.websocket.TokenHandshakeInterceptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import java.util.List;

/**
 * Registers the live sentiment stream endpoint.
 *
 * Allowed origins follow the CORS configuration so browser clients served from the
 * same frontends can connect.
 *
 * @see com.salesanalytics.config.CorsConfig
 */
@Configuration
@EnableWebSocket
@Slf4j
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final SentimentWebSocketHandler sentimentWebSocketHandler;
    private final TokenHandshakeInterceptor tokenHandshakeInterceptor;

    @Value("${app.cors.allowed-origins:http://localhost:3000,http://localhost:5173}")
    private List<String> allowedOrigins;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(sentimentWebSocketHandler, TokenHandshakeInterceptor.ENDPOINT)
                .addInterceptors(tokenHandshakeInterceptor)
                .setAllowedOriginPatterns(allowedOrigins.toArray(String[]::new));
        log.info("Registered sentiment stream endpoint {} for origins {}", TokenHandshakeInterceptor.ENDPOINT, allowedOrigins);
    }
}
