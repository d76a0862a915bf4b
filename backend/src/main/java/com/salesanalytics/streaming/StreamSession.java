package com.salesanalytics.streaming;

import com.salesanalytics.security.Identity;
import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

/**
 * One admitted subscriber of one call.
 *
 * Bound to a single call for its whole life. Once detached (unsubscribed, or told its
 * stream stopped) it never receives another message; sends and detaching are serialized
 * on the session's monitor.
 */
@Getter
public class StreamSession {

    private final String id;
    private final String callId;
    private final Identity identity;
    private final StreamConnection connection;
    private final Instant subscribedAt;
    private volatile Instant lastActivity;
    private boolean detached;

    public StreamSession(String callId, Identity identity, StreamConnection connection, Instant subscribedAt) {
        this.id = UUID.randomUUID().toString();
        this.callId = callId;
        this.identity = identity;
        this.connection = connection;
        this.subscribedAt = subscribedAt;
        this.lastActivity = subscribedAt;
    }

    public void touch(Instant now) {
        this.lastActivity = now;
    }

    public synchronized boolean isDetached() {
        return detached;
    }

    synchronized void detach() {
        detached = true;
    }

    @Override
    public String toString() {
        return "StreamSession{id=" + id + ", callId=" + callId + ", subject=" + identity.subject() + "}";
    }
}
