package com.salesanalytics.exception;

/**
 * Exception thrown when a call identifier is unknown to the call ledger, or when a
 * known call has no stored embedding to recommend from.
 *
 * GlobalExceptionHandler maps this to HTTP 404 Not Found.
 */
public class CallNotFoundException extends AnalyticsException {

    public CallNotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    /**
     * Constructs a new CallNotFoundException for an unknown call.
     *
     * @param callId the call identifier that was not found
     * @return a CallNotFoundException with a formatted message
     */
    public static CallNotFoundException forCall(String callId) {
        return new CallNotFoundException(String.format("Call '%s' not found.", callId));
    }

    /**
     * Constructs a new CallNotFoundException for a call without an embedding.
     *
     * @param callId the call identifier
     * @return a CallNotFoundException with a formatted message
     */
    public static CallNotFoundException embeddingMissing(String callId) {
        return new CallNotFoundException(
                String.format("No embedding is stored for call '%s'.", callId)
        );
    }

    /**
     * Constructs a new CallNotFoundException for a call without a live stream.
     *
     * @param callId the call identifier
     * @return a CallNotFoundException with a formatted message
     */
    public static CallNotFoundException noLiveStream(String callId) {
        return new CallNotFoundException(
                String.format("Call '%s' has no live sentiment stream.", callId)
        );
    }
}
