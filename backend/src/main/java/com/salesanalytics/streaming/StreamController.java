package com.salesanalytics.streaming;

import com.salesanalytics.exception.StreamingException;
import com.salesanalytics.security.Identity;
import com.salesanalytics.sentiment.SentimentSample;
import com.salesanalytics.sentiment.SentimentSampler;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Drives the live sentiment stream of every call.
 *
 * Lifecycle per call:
 * 1. First subscriber admitted: the sampling loop is scheduled, first tick one interval later
 * 2. Each tick samples outside the call's lock, stamps and appends under it, then sends to
 *    the subscribers it saw there after releasing it
 * 3. Stop (client request, repeated failures, idle, shutdown): loop cancelled, subscribers
 *    notified with {@code stream_stopped} and closed, state removed
 *
 * A sample that completes after its loop was stopped or restarted is discarded, so
 * no {@code sentiment_update} ever follows a {@code stream_stopped} of the same stream.
 *
 * Threading:
 * - Ticks run on the shared stream scheduler, commands on transport threads
 * - Every state change of a call is serialized by that call's lock
 * - Calls never block each other
 */
@Service
@Slf4j
public class StreamController {

    private final SessionRegistry sessionRegistry;
    private final CallStreamRegistry callStreamRegistry;
    private final SentimentSampler sentimentSampler;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final StreamingProperties properties;

    public StreamController(SessionRegistry sessionRegistry,
                            CallStreamRegistry callStreamRegistry,
                            SentimentSampler sentimentSampler,
                            @Qualifier("streamScheduler") TaskScheduler scheduler,
                            Clock clock,
                            StreamingProperties properties) {
        this.sessionRegistry = sessionRegistry;
        this.callStreamRegistry = callStreamRegistry;
        this.sentimentSampler = sentimentSampler;
        this.scheduler = scheduler;
        this.clock = clock;
        this.properties = properties;
        sessionRegistry.setIdleListener(this::onIdle);
    }

    /**
     * Admit a subscriber and start the call's loop if it is not running.
     *
     * The new session receives {@code connection_established} followed by the current
     * history when there is any.
     *
     * @param callId the call to follow
     * @param identity the verified caller
     * @param connection the transport to push messages to
     * @return the admitted session
     * @throws com.salesanalytics.exception.AnalyticsException if admission is rejected
     */
    public StreamSession subscribe(String callId, Identity identity, StreamConnection connection) {
        StreamSession session = sessionRegistry.admit(callId, identity, connection);

        Optional<CallStreamState> found = callStreamRegistry.find(callId);
        if (found.isEmpty()) {
            log.debug("Call {} stopped before session {} was set up", callId, session.getId());
            return session;
        }
        CallStreamState state = found.get();
        state.lock();
        try {
            if (state.isRetired() || !state.hasSubscriber(session.getId())) {
                log.debug("Call {} stopped before session {} was set up", callId, session.getId());
                return session;
            }
            state.cancelPendingStop();

            sessionRegistry.send(session.getId(), StreamMessage.connectionEstablished(callId, session.getId()));
            if (!state.getHistory().isEmpty()) {
                sessionRegistry.send(session.getId(), StreamMessage.history(state.getHistory().snapshot()));
            }

            if (state.getState() != StreamState.ACTIVE && !state.isRetired() && state.subscriberCount() > 0) {
                startLoop(state);
            }
        } finally {
            state.unlock();
        }
        return session;
    }

    /**
     * Remove a subscriber, e.g. after its transport closed. Idempotent.
     */
    public void unsubscribe(String sessionId) {
        sessionRegistry.remove(sessionId);
    }

    /**
     * Handle one inbound command from a session. Unknown types are answered with
     * {@code error(UNKNOWN_COMMAND)} to the sender only.
     *
     * @param sessionId the sending session
     * @param type the command type, or null if the message could not be parsed
     */
    public void handleCommand(String sessionId, String type) {
        Optional<StreamSession> found = sessionRegistry.find(sessionId);
        if (found.isEmpty()) {
            log.debug("Ignoring command '{}' from unknown session {}", type, sessionId);
            return;
        }
        StreamSession session = found.get();
        session.touch(clock.instant());

        Optional<StreamCommand> command = StreamCommand.fromType(type);
        if (command.isEmpty()) {
            StreamingException error = StreamingException.unknownCommand(type);
            log.warn("Session {} sent unknown command '{}'", sessionId, type);
            sessionRegistry.send(sessionId, StreamMessage.error(error));
            return;
        }

        switch (command.get()) {
            case PING -> sessionRegistry.send(sessionId, StreamMessage.pong());
            case GET_HISTORY -> sessionRegistry.send(sessionId,
                    StreamMessage.history(history(session.getCallId()).orElse(List.of())));
            case STOP_STREAMING -> {
                log.info("Session {} requested stop of call {}", sessionId, session.getCallId());
                stop(session.getCallId(), StopReason.STOPPED);
            }
        }
    }

    /**
     * Stop a call's stream and close all of its sessions.
     *
     * Every subscriber gets {@code stream_stopped} with the reason, then its connection is
     * closed ({@code GOING_AWAY} on shutdown, {@code NORMAL} otherwise). Samples still in
     * flight for the stopped loop are discarded.
     *
     * @param callId the call whose stream to stop
     * @param reason why the stream stops
     * @return false if the call had no stream
     */
    public boolean stop(String callId, StopReason reason) {
        Optional<CallStreamState> found = callStreamRegistry.find(callId);
        if (found.isEmpty()) {
            return false;
        }
        CallStreamState state = found.get();
        state.lock();
        try {
            return stopLocked(state, reason);
        } finally {
            state.unlock();
        }
    }

    /**
     * Bounded history of a call, oldest first; empty if the call has no stream.
     */
    public Optional<List<SentimentSample>> history(String callId) {
        return callStreamRegistry.find(callId).map(state -> {
            state.lock();
            try {
                return state.getHistory().snapshot();
            } finally {
                state.unlock();
            }
        });
    }

    public List<ActiveStream> activeStreams() {
        return callStreamRegistry.all().stream()
                .map(state -> {
                    state.lock();
                    try {
                        if (state.isRetired()) {
                            return null;
                        }
                        return new ActiveStream(
                                state.getCallId(),
                                state.getState(),
                                state.subscriberCount(),
                                state.getHistory().size(),
                                state.getLastSequence());
                    } finally {
                        state.unlock();
                    }
                })
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(ActiveStream::callId))
                .toList();
    }

    @PreDestroy
    public void shutdown() {
        List<CallStreamState> streams = List.copyOf(callStreamRegistry.all());
        log.info("Stopping {} call streams for shutdown", streams.size());
        streams.forEach(state -> stop(state.getCallId(), StopReason.SHUTDOWN));
        callStreamRegistry.teardown();
    }

    void tick(String callId, long generation) {
        Optional<CallStreamState> found = callStreamRegistry.find(callId);
        if (found.isEmpty()) {
            return;
        }
        CallStreamState state = found.get();

        SentimentSample sample;
        try {
            sample = sentimentSampler.sample(callId);
        } catch (RuntimeException e) {
            onSampleFailure(state, generation, e);
            return;
        }

        SentimentSample stamped;
        List<StreamSession> recipients;
        state.lock();
        try {
            if (!state.isCurrentLoop(generation)) {
                log.debug("Discarding sample for call {}: stream no longer active", callId);
                return;
            }
            state.resetFailures();
            stamped = sample
                    .withSequence(state.nextSequence())
                    .withTimestamp(state.nextTimestamp(sample.getTimestamp()));
            if (!state.getHistory().append(stamped)) {
                return;
            }
            recipients = state.subscribers();
        } finally {
            state.unlock();
        }

        // ticks of one loop never overlap, so sends still go out in sequence order
        int delivered = sessionRegistry.deliverAll(recipients, StreamMessage.sentimentUpdate(stamped));
        log.debug("Call {} sample #{} score={} delivered to {} session(s)",
                callId, stamped.getSequence(), stamped.getSentimentScore(), delivered);
    }

    void onIdle(String callId) {
        Optional<CallStreamState> found = callStreamRegistry.find(callId);
        if (found.isEmpty()) {
            return;
        }
        CallStreamState state = found.get();
        state.lock();
        try {
            if (state.isRetired() || state.subscriberCount() > 0) {
                return;
            }
            Duration grace = properties.getStopGracePeriod();
            if (grace == null || grace.isZero() || grace.isNegative()) {
                stopLocked(state, StopReason.IDLE);
                return;
            }
            if (state.getPendingStop() == null) {
                log.info("Call {} has no subscribers, stopping in {}", callId, grace);
                state.setPendingStop(scheduler.schedule(() -> graceExpired(state), clock.instant().plus(grace)));
            }
        } finally {
            state.unlock();
        }
    }

    private void graceExpired(CallStreamState state) {
        state.lock();
        try {
            state.setPendingStop(null);
            if (state.isRetired() || state.subscriberCount() > 0) {
                return;
            }
            stopLocked(state, StopReason.IDLE);
        } finally {
            state.unlock();
        }
    }

    private void startLoop(CallStreamState state) {
        String callId = state.getCallId();
        Duration interval = properties.getTickInterval();
        state.beginLoop(generation -> scheduler.scheduleAtFixedRate(
                () -> tick(callId, generation),
                clock.instant().plus(interval),
                interval));
        log.info("Started sentiment stream for call {} (every {})", callId, interval);
    }

    private void onSampleFailure(CallStreamState state, long generation, RuntimeException error) {
        state.lock();
        try {
            if (!state.isCurrentLoop(generation)) {
                return;
            }
            int failures = state.recordFailure();
            int limit = properties.getMaxConsecutiveFailures();
            log.warn("Sampling failed for call {} ({}/{}): {}", state.getCallId(), failures, limit, error.getMessage());
            if (failures >= limit) {
                StreamingException failure = StreamingException.streamFailure(state.getCallId(), failures);
                log.error(failure.getMessage());
                sessionRegistry.broadcast(state.getCallId(), StreamMessage.error(failure));
                stopLocked(state, StopReason.FAILURE);
            }
        } finally {
            state.unlock();
        }
    }

    private boolean stopLocked(CallStreamState state, StopReason reason) {
        if (state.isRetired()) {
            return false;
        }
        String callId = state.getCallId();
        int subscribers = state.subscriberCount();
        callStreamRegistry.retire(state);

        StreamConnection.CloseCode closeCode = reason == StopReason.SHUTDOWN
                ? StreamConnection.CloseCode.GOING_AWAY
                : StreamConnection.CloseCode.NORMAL;
        sessionRegistry.detachAll(state, StreamMessage.streamStopped(reason), closeCode);
        sentimentSampler.release(callId);

        log.info("Stopped sentiment stream for call {} ({}), {} session(s) closed", callId, reason.getValue(), subscribers);
        return true;
    }
}
