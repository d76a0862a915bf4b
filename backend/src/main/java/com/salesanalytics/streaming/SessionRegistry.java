package com.salesanalytics.streaming;

import com.salesanalytics.exception.CallNotFoundException;
import com.salesanalytics.exception.StreamingException;
import com.salesanalytics.exception.UnauthorizedException;
import com.salesanalytics.ledger.CallLedger;
import com.salesanalytics.security.Identity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Admits, tracks and removes subscriber sessions, and fans messages out to them.
 *
 * Admission checks run in a fixed order (identity and role, call existence, per-call cap,
 * per-identity cap) and a rejected admission leaves no trace. Every mutation of a
 * call's subscriber set happens under that call's lock.
 *
 * Delivery is best effort: a session whose send fails is dropped and the
 * remaining sessions still receive the message.
 */
@Service
@Slf4j
public class SessionRegistry {

    private final CallStreamRegistry callStreamRegistry;
    private final CallLedger callLedger;
    private final StreamingProperties properties;
    private final Clock clock;

    private final Map<String, StreamSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, Integer> sessionsPerIdentity = new ConcurrentHashMap<>();

    private volatile IdleListener idleListener = callId -> { };

    public SessionRegistry(CallStreamRegistry callStreamRegistry, CallLedger callLedger,
                           StreamingProperties properties, Clock clock) {
        this.callStreamRegistry = callStreamRegistry;
        this.callLedger = callLedger;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Signalled when the last subscriber of a call goes away.
     */
    @FunctionalInterface
    public interface IdleListener {
        void onCallIdle(String callId);
    }

    public void setIdleListener(IdleListener idleListener) {
        this.idleListener = idleListener;
    }

    /**
     * Admit a subscriber to a call's stream.
     *
     * The call's state is created on first admission. Rejections leave no session and
     * no empty state behind.
     *
     * @param callId the call to follow
     * @param identity the verified caller, may be null (rejected)
     * @param connection the subscriber's transport
     * @return the registered session
     * @throws UnauthorizedException if the identity is missing or its role may not subscribe
     * @throws CallNotFoundException if the call is unknown to the ledger
     * @throws StreamingException with {@code TOO_MANY_SESSIONS} if a session cap is reached
     */
    public StreamSession admit(String callId, Identity identity, StreamConnection connection) {
        if (identity == null) {
            throw UnauthorizedException.missingIdentity();
        }
        if (!properties.getAllowedRoles().contains(identity.role())) {
            log.warn("Rejected stream subscription to {} by {}: role {} not permitted",
                    callId, identity.subject(), identity.role().getValue());
            throw UnauthorizedException.roleNotPermitted(identity.role());
        }
        if (!callLedger.exists(callId)) {
            log.warn("Rejected stream subscription by {}: call {} not found", identity.subject(), callId);
            throw CallNotFoundException.forCall(callId);
        }

        CallStreamState state = callStreamRegistry.acquire(callId);
        try {
            if (state.subscriberCount() >= properties.getMaxSessionsPerCall()) {
                log.warn("Rejected stream subscription to {} by {}: call at capacity ({})",
                        callId, identity.subject(), properties.getMaxSessionsPerCall());
                throw StreamingException.tooManySessionsForCall(callId, properties.getMaxSessionsPerCall());
            }
            reserveIdentitySlot(identity.subject());

            StreamSession session = new StreamSession(callId, identity, connection, clock.instant());
            state.addSubscriber(session);
            sessions.put(session.getId(), session);

            log.info("Admitted session {} for {} ({}) to call {}; {} subscriber(s)",
                    session.getId(), identity.subject(), identity.role().getValue(), callId, state.subscriberCount());
            return session;
        } catch (RuntimeException e) {
            discardIfUnused(state);
            throw e;
        } finally {
            state.unlock();
        }
    }

    /**
     * Remove a session. Removing an unknown or already removed session does nothing.
     */
    public void remove(String sessionId) {
        StreamSession session = sessions.remove(sessionId);
        if (session == null) {
            return;
        }
        session.detach();
        releaseIdentitySlot(session.getIdentity().subject());

        boolean idle = false;
        Optional<CallStreamState> found = callStreamRegistry.find(session.getCallId());
        if (found.isPresent()) {
            CallStreamState state = found.get();
            state.lock();
            try {
                if (state.removeSubscriber(sessionId) != null) {
                    idle = !state.isRetired() && state.subscriberCount() == 0;
                }
            } finally {
                state.unlock();
            }
        }

        log.info("Removed session {} from call {}", sessionId, session.getCallId());
        if (idle) {
            idleListener.onCallIdle(session.getCallId());
        }
    }

    public Optional<StreamSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public int sessionCount() {
        return sessions.size();
    }

    /**
     * Send a message to every subscriber of a call, in admission order.
     *
     * The subscriber set is read under the call's lock; the sends happen after it is
     * released, so a slow connection never blocks other operations on the call.
     *
     * @return the number of sessions the message was delivered to
     */
    public int broadcast(String callId, StreamMessage message) {
        Optional<CallStreamState> found = callStreamRegistry.find(callId);
        if (found.isEmpty()) {
            return 0;
        }
        CallStreamState state = found.get();
        List<StreamSession> recipients;
        state.lock();
        try {
            recipients = state.subscribers();
        } finally {
            state.unlock();
        }
        return deliverAll(recipients, message);
    }

    /**
     * Send a message to a snapshot of subscribers. Sessions detached since the snapshot
     * was taken are skipped; sessions whose send fails are removed.
     *
     * @return the number of sessions the message was delivered to
     */
    int deliverAll(List<StreamSession> recipients, StreamMessage message) {
        List<String> failed = new ArrayList<>();
        int delivered = 0;
        for (StreamSession session : recipients) {
            if (session.isDetached()) {
                continue;
            }
            if (deliver(session, message)) {
                delivered++;
            } else {
                failed.add(session.getId());
            }
        }
        failed.forEach(this::remove);
        return delivered;
    }

    /**
     * Send a message to one session only.
     *
     * @return false if the session is unknown or the send failed (the session is then removed)
     */
    public boolean send(String sessionId, StreamMessage message) {
        StreamSession session = sessions.get(sessionId);
        if (session == null) {
            return false;
        }
        if (deliver(session, message)) {
            return true;
        }
        remove(sessionId);
        return false;
    }

    /**
     * Notify and close every subscriber of a stopping call, then empty its subscriber set.
     * Caller holds the state's lock. The idle listener is not signalled.
     */
    void detachAll(CallStreamState state, StreamMessage notice, StreamConnection.CloseCode closeCode) {
        for (StreamSession session : state.subscribers()) {
            synchronized (session) {
                deliver(session, notice);
                session.detach();
            }
            session.getConnection().close(closeCode);
            if (sessions.remove(session.getId()) != null) {
                releaseIdentitySlot(session.getIdentity().subject());
            }
        }
        state.clearSubscribers();
    }

    int sessionsOf(String subject) {
        return sessionsPerIdentity.getOrDefault(subject, 0);
    }

    private boolean deliver(StreamSession session, StreamMessage message) {
        synchronized (session) {
            if (session.isDetached()) {
                log.debug("Session {} already detached, dropping {}", session.getId(), message.getType());
                return false;
            }
            StreamConnection connection = session.getConnection();
            if (!connection.isOpen()) {
                log.debug("Session {} connection already closed, dropping {}", session.getId(), message.getType());
                return false;
            }
            try {
                connection.send(message);
                return true;
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to send {} to session {}: {}", message.getType(), session.getId(), e.getMessage());
                return false;
            }
        }
    }

    private void reserveIdentitySlot(String subject) {
        int cap = properties.getMaxSessionsPerIdentity();
        sessionsPerIdentity.compute(subject, (key, count) -> {
            int current = count == null ? 0 : count;
            if (current >= cap) {
                log.warn("Rejected stream subscription by {}: {} sessions already open", subject, current);
                throw StreamingException.tooManySessionsForIdentity(subject, cap);
            }
            return current + 1;
        });
    }

    private void releaseIdentitySlot(String subject) {
        sessionsPerIdentity.computeIfPresent(subject, (key, count) -> count <= 1 ? null : count - 1);
    }

    private void discardIfUnused(CallStreamState state) {
        if (state.subscriberCount() == 0 && state.getState() == StreamState.IDLE) {
            callStreamRegistry.retire(state);
        }
    }
}
