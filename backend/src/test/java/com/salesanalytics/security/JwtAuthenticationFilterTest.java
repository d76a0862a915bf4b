package com.salesanalytics.security;

import com.salesanalytics.exception.UnauthorizedException;
import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("JwtAuthenticationFilter Unit Tests")
class JwtAuthenticationFilterTest {

    @Mock
    private JwtTokenProvider jwtTokenProvider;

    @Mock
    private FilterChain filterChain;

    private JwtAuthenticationFilter filter;

    @BeforeEach
    void setUp() {
        filter = new JwtAuthenticationFilter(jwtTokenProvider);
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    @DisplayName("valid Bearer token should populate the security context")
    void testValidToken_SetsAuthentication() throws Exception {
        // Arrange
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/streams");
        request.addHeader("Authorization", "Bearer good-token");
        Identity identity = new Identity("alice", Role.MANAGER);
        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken("alice", null, List.of());
        when(jwtTokenProvider.extractTokenFromHeader("Bearer good-token")).thenReturn("good-token");
        when(jwtTokenProvider.verify("good-token")).thenReturn(identity);
        when(jwtTokenProvider.getAuthentication(identity)).thenReturn(authentication);

        // Act
        filter.doFilter(request, new MockHttpServletResponse(), filterChain);

        // Assert
        assertSame(authentication, SecurityContextHolder.getContext().getAuthentication());
        verify(filterChain).doFilter(any(), any());
    }

    @Test
    @DisplayName("invalid token should leave the request unauthenticated and continue the chain")
    void testInvalidToken_ClearsContext() throws Exception {
        // Arrange
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/streams");
        request.addHeader("Authorization", "Bearer bad-token");
        when(jwtTokenProvider.extractTokenFromHeader("Bearer bad-token")).thenReturn("bad-token");
        when(jwtTokenProvider.verify("bad-token")).thenThrow(UnauthorizedException.invalidToken("token expired"));

        // Act
        filter.doFilter(request, new MockHttpServletResponse(), filterChain);

        // Assert
        assertNull(SecurityContextHolder.getContext().getAuthentication());
        verify(filterChain).doFilter(any(), any());
    }

    @Test
    @DisplayName("WebSocket handshake paths should bypass the filter")
    void testWebSocketPath_NotFiltered() throws Exception {
        // Arrange
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/ws/sentiment/call-1");
        request.addHeader("Authorization", "Bearer whatever");

        // Act
        filter.doFilter(request, new MockHttpServletResponse(), filterChain);

        // Assert
        verifyNoInteractions(jwtTokenProvider);
        verify(filterChain).doFilter(any(), any());
    }
}
