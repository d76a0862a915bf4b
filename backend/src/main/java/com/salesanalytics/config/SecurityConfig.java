package com.salesanalytics.config;

import com.salesanalytics.security.JwtAuthenticationFilter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Spring Security configuration for JWT-based authentication.
 *
 * - REST endpoints require a Bearer token verified by {@link JwtAuthenticationFilter}
 * - The WebSocket endpoint is open at the HTTP layer; its handshake interceptor
 *   verifies the {@code token} query parameter itself
 * - Service banner and health endpoints are public
 * - Stateless sessions, CSRF disabled, method security for role-restricted endpoints
 *
 * Authentication Flow:
 * 1. Client obtains an access token from the identity provider (not issued here)
 * 2. REST calls carry it as {@code Authorization: Bearer {token}}
 * 3. JwtAuthenticationFilter verifies it and fills the security context
 * 4. {@code @PreAuthorize} checks the role on restricted endpoints
 *
 * Security Considerations:
 * - Unauthenticated requests get 401 from the entry point
 * - Authenticated requests without the required role get 403
 * - Tokens are HMAC-signed; expiry is enforced by JwtTokenProvider
 *
 * @see com.salesanalytics.security.JwtAuthenticationFilter
 * @see com.salesanalytics.websocket.TokenHandshakeInterceptor
 */
@Configuration
@EnableWebSecurity
@EnableMethodSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    private final JwtAuthenticationFilter jwtAuthenticationFilter;

    /**
     * Configure the security filter chain.
     *
     * @param http the HttpSecurity builder to configure
     * @return the configured SecurityFilterChain
     * @throws Exception if configuration fails
     */
    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        http
                // Stateless token authentication, no CSRF token needed
                .csrf(AbstractHttpConfigurer::disable)

                .authorizeHttpRequests(auth -> auth
                        // Banner, health and the WebSocket upgrade (authenticated by its interceptor)
                        .requestMatchers(
                                "/",
                                "/health",
                                "/ws/**",
                                "/error",
                                "/actuator/health",
                                "/actuator/info"
                        ).permitAll()
                        .anyRequest().authenticated()
                )

                .sessionManagement(session -> session
                        .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
                )

                // 401 instead of the default 403 for missing credentials
                .exceptionHandling(exceptions -> exceptions
                        .authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED))
                )

                .addFilterBefore(
                        jwtAuthenticationFilter,
                        UsernamePasswordAuthenticationFilter.class
                );

        return http.build();
    }
}
