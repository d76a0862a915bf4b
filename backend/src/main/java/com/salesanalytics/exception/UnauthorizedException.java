package com.salesanalytics.exception;

import com.salesanalytics.security.Role;

/**
 * Exception thrown when a caller cannot be identified or is not allowed in.
 *
 * Raised by the identity verifier for missing, malformed, expired or badly signed
 * tokens, and by the session registry when the verified role is not admitted to
 * live streams. Admission failures are raised before any session state exists.
 *
 * GlobalExceptionHandler maps this to HTTP 401 Unauthorized with RFC 7807 format;
 * the WebSocket handshake maps it to a 401 rejection before upgrade.
 *
 * @see com.salesanalytics.security.JwtTokenProvider
 * @see com.salesanalytics.streaming.SessionRegistry
 */
public class UnauthorizedException extends AnalyticsException {

    /**
     * Constructs a new UnauthorizedException with the specified detail message.
     *
     * @param message the detail message explaining the failure
     */
    public UnauthorizedException(String message) {
        super(ErrorCode.UNAUTHORIZED, message);
    }

    /**
     * Constructs a new UnauthorizedException with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause of the exception
     */
    public UnauthorizedException(String message, Throwable cause) {
        super(ErrorCode.UNAUTHORIZED, message, cause);
    }

    /**
     * Constructs a new UnauthorizedException for a missing token.
     *
     * @return an UnauthorizedException with a formatted message
     */
    public static UnauthorizedException missingToken() {
        return new UnauthorizedException("Missing authentication token.");
    }

    /**
     * Constructs a new UnauthorizedException for a token that failed verification.
     *
     * @param reason short reason (e.g., "expired", "invalid signature")
     * @return an UnauthorizedException with a formatted message
     */
    public static UnauthorizedException invalidToken(String reason) {
        return new UnauthorizedException(
                String.format("Invalid authentication token: %s.", reason)
        );
    }

    /**
     * Constructs a new UnauthorizedException when no identity accompanies an admission.
     *
     * @return an UnauthorizedException with a formatted message
     */
    public static UnauthorizedException missingIdentity() {
        return new UnauthorizedException("No verified identity was supplied for this connection.");
    }

    /**
     * Constructs a new UnauthorizedException for a role that may not subscribe to streams.
     *
     * @param role the verified role
     * @return an UnauthorizedException with a formatted message
     */
    public static UnauthorizedException roleNotPermitted(Role role) {
        return new UnauthorizedException(
                String.format("Role '%s' is not permitted to subscribe to sentiment streams.", role.getValue())
        );
    }
}
