package com.salesanalytics.exception;

/**
 * Base class for all domain failures of the streaming and recommendation core.
 *
 * Subclasses carry a stable {@link ErrorCode}; the message is always safe to show
 * to a client. Causes are kept for logging only and are never serialized.
 *
 * @see com.salesanalytics.exception.GlobalExceptionHandler
 */
public abstract class AnalyticsException extends RuntimeException {

    private final ErrorCode errorCode;

    protected AnalyticsException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected AnalyticsException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Gets the reason code reported to the client.
     *
     * @return the error code, never null
     */
    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
