package com.salesanalytics.security;

import com.salesanalytics.exception.UnauthorizedException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Authenticates REST requests from the {@code Authorization: Bearer} header.
 *
 * Flow:
 * 1. Extract the token from the Authorization header
 * 2. Verify signature, expiry, subject and role claim
 * 3. Put an authentication carrying {@code ROLE_<ROLE>} into the security context
 * 4. Continue the filter chain
 *
 * A missing or invalid token leaves the security context empty; SecurityConfig then
 * decides whether the endpoint needs authentication. WebSocket handshakes are
 * skipped here because they authenticate through the {@code token} query parameter.
 *
 * Security Notes:
 * - Verification failures are logged at warn without the token itself
 * - The context is cleared on failure so no stale authentication survives
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private final JwtTokenProvider jwtTokenProvider;

    /**
     * Verify the Bearer token, if any, and set the authentication.
     *
     * @param request the HTTP request
     * @param response the HTTP response
     * @param filterChain the remaining filter chain
     * @throws ServletException if a downstream filter fails
     * @throws IOException if an I/O error occurs downstream
     */
    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        String token = jwtTokenProvider.extractTokenFromHeader(request.getHeader("Authorization"));

        if (token != null) {
            try {
                Identity identity = jwtTokenProvider.verify(token);
                Authentication authentication = jwtTokenProvider.getAuthentication(identity);
                SecurityContextHolder.getContext().setAuthentication(authentication);

                log.debug("Set authentication for user: {} ({}) on path: {}",
                        identity.subject(), identity.role().getValue(), request.getRequestURI());
            } catch (UnauthorizedException ex) {
                log.warn("Invalid JWT token on path: {} - {}", request.getRequestURI(), ex.getMessage());
                SecurityContextHolder.clearContext();
            }
        }

        filterChain.doFilter(request, response);
    }

    /**
     * Skip the error page and WebSocket handshakes.
     */
    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path.startsWith("/error") || path.startsWith("/ws/");
    }
}
