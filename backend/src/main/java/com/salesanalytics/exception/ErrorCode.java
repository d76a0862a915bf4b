package com.salesanalytics.exception;

import org.springframework.http.HttpStatus;

/**
 * Stable reason codes reported to clients.
 *
 * Every error that reaches a client (REST problem detail or WebSocket {@code error}
 * message) carries one of these codes plus a human-readable message. The HTTP status
 * is only used by the REST surface.
 */
public enum ErrorCode {

    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "Unauthorized", "unauthorized"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "Call Not Found", "not-found"),
    TOO_MANY_SESSIONS(HttpStatus.TOO_MANY_REQUESTS, "Too Many Sessions", "too-many-sessions"),
    UNKNOWN_COMMAND(HttpStatus.BAD_REQUEST, "Unknown Command", "unknown-command"),
    STREAM_FAILURE(HttpStatus.SERVICE_UNAVAILABLE, "Stream Failure", "stream-failure"),
    NO_CORPUS(HttpStatus.CONFLICT, "No Corpus", "no-corpus"),
    DIMENSION_MISMATCH(HttpStatus.UNPROCESSABLE_ENTITY, "Dimension Mismatch", "dimension-mismatch"),
    SCORER_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "Scorer Unavailable", "scorer-unavailable"),
    ANALYSIS_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "Analysis Failed", "analysis-failed"),
    INVALID_RESPONSE(HttpStatus.BAD_GATEWAY, "Invalid AI Response", "invalid-response");

    private final HttpStatus httpStatus;
    private final String title;
    private final String typeSlug;

    ErrorCode(HttpStatus httpStatus, String title, String typeSlug) {
        this.httpStatus = httpStatus;
        this.title = title;
        this.typeSlug = typeSlug;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getTitle() {
        return title;
    }

    /**
     * Slug used to build the RFC 7807 {@code type} URI.
     */
    public String getTypeSlug() {
        return typeSlug;
    }
}
