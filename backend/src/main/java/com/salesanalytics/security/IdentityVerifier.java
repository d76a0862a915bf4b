package com.salesanalytics.security;

import com.salesanalytics.exception.UnauthorizedException;

/**
 * Validates an opaque access token and returns the caller's identity.
 *
 * Called once per connection admission and once per authenticated REST request.
 * How the token arrives (Authorization header, WebSocket query parameter) is the
 * caller's concern.
 */
public interface IdentityVerifier {

    /**
     * Verify a token.
     *
     * @param token the raw token, may be null
     * @return the verified identity
     * @throws UnauthorizedException if the token is missing or fails verification
     */
    Identity verify(String token);
}
