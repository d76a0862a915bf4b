package com.salesanalytics.security;

import com.salesanalytics.exception.UnauthorizedException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Date;

/**
 * JWT-backed {@link IdentityVerifier}.
 *
 * Tokens are HS256-signed; the subject is the username and the {@code role} claim
 * holds one of {@code admin}, {@code manager} or {@code agent}. Tokens are minted
 * by the credential service that shares {@code jwt.secret}; this service only
 * verifies them. {@link #generateToken(String, Role)} exists for that collaborator
 * and for tests.
 *
 * Security Features:
 * - Signature, expiration and structure validated on every verification
 * - Unknown or missing role claims are rejected
 * - Thread-safe: the parser key is immutable after initialization
 *
 * @see io.jsonwebtoken.Jwts
 */
@Component
@Slf4j
public class JwtTokenProvider implements IdentityVerifier {

    static final String ROLE_CLAIM = "role";

    @Value("${jwt.secret}")
    private String jwtSecret;

    @Value("${jwt.expiration}")
    private long jwtExpirationMs;

    private SecretKey secretKey;

    /**
     * Initialize the secret key after properties are injected.
     */
    @PostConstruct
    public void init() {
        this.secretKey = Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8));
        log.info("JWT Token Provider initialized with expiration: {} ms", jwtExpirationMs);
    }

    /**
     * Generate a signed token for a subject and role.
     *
     * @param subject the username
     * @param role the role to embed
     * @return JWT token string
     */
    public String generateToken(String subject, Role role) {
        Date now = new Date();
        Date expiryDate = new Date(now.getTime() + jwtExpirationMs);

        String token = Jwts.builder()
                .subject(subject)
                .claim(ROLE_CLAIM, role.getValue())
                .issuedAt(now)
                .expiration(expiryDate)
                .signWith(secretKey, Jwts.SIG.HS256)
                .compact();

        log.debug("Generated JWT token for subject: {} (role: {})", subject, role.getValue());
        return token;
    }

    /**
     * Verify a token and extract the caller's identity.
     *
     * @param token the JWT token, may be null
     * @return the verified identity
     * @throws UnauthorizedException if the token is missing, invalid, expired or carries no known role
     */
    @Override
    public Identity verify(String token) {
        if (token == null || token.isBlank()) {
            throw UnauthorizedException.missingToken();
        }

        Claims claims = parseClaims(token);

        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            log.warn("JWT token without subject rejected");
            throw UnauthorizedException.invalidToken("missing subject");
        }

        String roleClaim = claims.get(ROLE_CLAIM, String.class);
        Role role = Role.fromValue(roleClaim).orElseThrow(() -> {
            log.warn("JWT token for subject {} carries unknown role: {}", subject, roleClaim);
            return UnauthorizedException.invalidToken("missing or unknown role");
        });

        return new Identity(subject, role);
    }

    /**
     * Validate JWT token signature, expiration, and structure.
     *
     * @param token the JWT token to validate
     * @return true if the token verifies to an identity, false otherwise
     */
    public boolean validateToken(String token) {
        try {
            verify(token);
            return true;
        } catch (UnauthorizedException ex) {
            return false;
        }
    }

    /**
     * Get a Spring Security Authentication for a verified identity.
     *
     * The principal is the subject; the single authority is {@code ROLE_<ROLE>}.
     * The identity itself is kept in the details.
     *
     * @param identity the verified identity
     * @return Authentication object with the role authority
     */
    public Authentication getAuthentication(Identity identity) {
        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(
                        identity.subject(),
                        null,
                        Collections.singletonList(new SimpleGrantedAuthority(identity.role().authority()))
                );

        authentication.setDetails(identity);
        return authentication;
    }

    /**
     * Extract JWT token from Authorization header.
     *
     * Expected header format: "Bearer {token}"
     *
     * @param bearerToken the Authorization header value
     * @return the JWT token string, or null if header is invalid
     */
    public String extractTokenFromHeader(String bearerToken) {
        if (bearerToken != null && bearerToken.startsWith("Bearer ")) {
            return bearerToken.substring(7);
        }
        return null;
    }

    public long getExpirationMs() {
        return jwtExpirationMs;
    }

    private Claims parseClaims(String token) {
        try {
            return Jwts.parser()
                    .verifyWith(secretKey)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (SignatureException ex) {
            log.error("Invalid JWT signature: {}", ex.getMessage());
            throw UnauthorizedException.invalidToken("invalid signature");
        } catch (MalformedJwtException ex) {
            log.error("Invalid JWT token: {}", ex.getMessage());
            throw UnauthorizedException.invalidToken("malformed token");
        } catch (ExpiredJwtException ex) {
            log.warn("Expired JWT token: {}", ex.getMessage());
            throw UnauthorizedException.invalidToken("token expired");
        } catch (UnsupportedJwtException ex) {
            log.error("Unsupported JWT token: {}", ex.getMessage());
            throw UnauthorizedException.invalidToken("unsupported token");
        } catch (JwtException | IllegalArgumentException ex) {
            log.error("JWT verification failed: {}", ex.getMessage());
            throw UnauthorizedException.invalidToken("verification failed");
        }
    }
}
