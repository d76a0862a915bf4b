package com.salesanalytics.exception;

/**
 * Exception thrown by the live sentiment stream: admission caps, protocol errors and
 * exhausted sampler retries.
 *
 * Per-command errors are reported to the offending session only and never close
 * its connection; {@code STREAM_FAILURE} is broadcast to every subscriber of the call.
 *
 * @see com.salesanalytics.streaming.StreamController
 * @see com.salesanalytics.streaming.SessionRegistry
 */
public class StreamingException extends AnalyticsException {

    public StreamingException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    /**
     * Constructs a new StreamingException when a call has reached its subscriber cap.
     *
     * @param callId the call identifier
     * @param cap the configured per-call cap
     * @return a StreamingException with a formatted message
     */
    public static StreamingException tooManySessionsForCall(String callId, int cap) {
        return new StreamingException(
                ErrorCode.TOO_MANY_SESSIONS,
                String.format("Call '%s' already has the maximum of %d live subscribers.", callId, cap)
        );
    }

    /**
     * Constructs a new StreamingException when an identity has too many open sessions.
     *
     * @param subject the identity subject
     * @param cap the configured per-identity cap
     * @return a StreamingException with a formatted message
     */
    public static StreamingException tooManySessionsForIdentity(String subject, int cap) {
        return new StreamingException(
                ErrorCode.TOO_MANY_SESSIONS,
                String.format("User '%s' already has the maximum of %d live sessions.", subject, cap)
        );
    }

    /**
     * Constructs a new StreamingException for an unrecognized client command.
     *
     * @param command the raw command type (may be null when the message was unparseable)
     * @return a StreamingException with a formatted message
     */
    public static StreamingException unknownCommand(String command) {
        if (command == null) {
            return new StreamingException(
                    ErrorCode.UNKNOWN_COMMAND,
                    "Message could not be understood. Expected JSON with a 'type' of ping, get_history or stop_streaming."
            );
        }
        return new StreamingException(
                ErrorCode.UNKNOWN_COMMAND,
                String.format("Unknown command '%s'. Supported commands: ping, get_history, stop_streaming.", command)
        );
    }

    /**
     * Constructs a new StreamingException when the sampler failed too many ticks in a row.
     *
     * @param callId the call identifier
     * @param failures number of consecutive failed ticks
     * @return a StreamingException with a formatted message
     */
    public static StreamingException streamFailure(String callId, int failures) {
        return new StreamingException(
                ErrorCode.STREAM_FAILURE,
                String.format("Sentiment stream for call '%s' stopped after %d consecutive sampling failures.",
                        callId, failures)
        );
    }
}
