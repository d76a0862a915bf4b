package com.salesanalytics.streaming;

import java.io.IOException;

/**
 * Outbound side of one subscriber's transport.
 *
 * The streaming core only ever pushes {@link StreamMessage}s and closes; the
 * WebSocket adapter decides how messages are framed and serialized.
 */
public interface StreamConnection {

    String getId();

    /**
     * @throws IOException if the message could not be delivered; the caller drops the session
     */
    void send(StreamMessage message) throws IOException;

    void close(CloseCode code);

    boolean isOpen();

    enum CloseCode {
        /** Stream ended normally (stopped, idle, failure). */
        NORMAL,
        /** Admission rejected after the transport was established. */
        POLICY_VIOLATION,
        /** Server shutting down. */
        GOING_AWAY
    }
}
