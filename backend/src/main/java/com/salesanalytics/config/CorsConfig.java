package com.salesanalytics.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

import java.util.List;

/**
 * CORS configuration for dashboard access to the REST API.
 *
 * The coaching dashboard is served from a different origin than this service, so the
 * browser needs CORS headers on the status, history, recommendation and analytics
 * endpoints.
 *
 * Features:
 * - Allowed origins, methods and headers configurable under {@code app.cors.*}
 * - Credentials support for the Authorization header
 * - Configurable max-age for preflight caching
 *
 * Security Considerations:
 * - In production, origins should be listed explicitly
 * - Wildcard origins are rejected by Spring when credentials are enabled
 * - The WebSocket endpoint reuses the same origin list for its handshake origin check
 *
 * @see com.salesanalytics.config.WebSocketConfig
 * @see org.springframework.web.filter.CorsFilter
 */
@Configuration
@Slf4j
public class CorsConfig {

    @Value("${app.cors.allowed-origins:http://localhost:3000,http://localhost:5173}")
    private List<String> allowedOrigins;

    @Value("${app.cors.allowed-methods:GET,OPTIONS}")
    private List<String> allowedMethods;

    @Value("${app.cors.allowed-headers:Authorization,Content-Type,Accept,Origin}")
    private List<String> allowedHeaders;

    @Value("${app.cors.allow-credentials:true}")
    private boolean allowCredentials;

    @Value("${app.cors.max-age:3600}")
    private long maxAge;

    /**
     * Configure the CORS filter applied to every path.
     *
     * Origins Configuration:
     * - Development: http://localhost:3000, http://localhost:5173
     * - Production: set {@code app.cors.allowed-origins} (env {@code CORS_ALLOWED_ORIGINS})
     *
     * When credentials are enabled, allowed origins cannot be "*"; list them explicitly.
     *
     * @return configured CorsFilter
     */
    @Bean
    public CorsFilter corsFilter() {
        CorsConfiguration config = new CorsConfiguration();

        // Only read endpoints are exposed, so GET and preflight are enough by default
        config.setAllowedOrigins(allowedOrigins);
        config.setAllowedMethods(allowedMethods);
        config.setAllowedHeaders(allowedHeaders);
        config.setAllowCredentials(allowCredentials);
        config.setMaxAge(maxAge);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", config);

        log.info("CORS allowed origins: {}, credentials: {}", allowedOrigins, allowCredentials);
        return new CorsFilter(source);
    }
}
