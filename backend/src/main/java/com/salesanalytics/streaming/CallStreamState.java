package com.salesanalytics.streaming;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Everything the server holds for one streamed call.
 *
 * All fields except the lock are guarded by {@link #lock()}. Once retired the
 * state is out of the registry for good; an admitter that finds a retired state
 * must fetch a fresh one.
 */
public class CallStreamState {

    private final String callId;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, StreamSession> subscribers = new LinkedHashMap<>();
    private final SentimentHistory history;

    private StreamState state = StreamState.IDLE;
    private long sequence;
    private Instant lastTimestamp;
    private int consecutiveFailures;
    private long loopGeneration;
    private ScheduledFuture<?> loop;
    private ScheduledFuture<?> pendingStop;
    private boolean retired;

    public CallStreamState(String callId, int historySize) {
        this.callId = callId;
        this.history = new SentimentHistory(historySize);
    }

    public String getCallId() {
        return callId;
    }

    public void lock() {
        lock.lock();
    }

    public void unlock() {
        lock.unlock();
    }

    // Subscribers

    void addSubscriber(StreamSession session) {
        subscribers.put(session.getId(), session);
    }

    StreamSession removeSubscriber(String sessionId) {
        return subscribers.remove(sessionId);
    }

    public boolean hasSubscriber(String sessionId) {
        return subscribers.containsKey(sessionId);
    }

    /**
     * Subscribers in admission order.
     */
    public List<StreamSession> subscribers() {
        return new ArrayList<>(subscribers.values());
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    void clearSubscribers() {
        subscribers.clear();
    }

    // Samples

    public SentimentHistory getHistory() {
        return history;
    }

    long nextSequence() {
        return ++sequence;
    }

    public long getLastSequence() {
        return sequence;
    }

    /**
     * The candidate if it is after the previous sample's timestamp, otherwise one
     * millisecond after the previous one.
     */
    Instant nextTimestamp(Instant candidate) {
        Instant next = candidate;
        if (lastTimestamp != null && !candidate.isAfter(lastTimestamp)) {
            next = lastTimestamp.plusMillis(1);
        }
        lastTimestamp = next;
        return next;
    }

    int recordFailure() {
        return ++consecutiveFailures;
    }

    void resetFailures() {
        consecutiveFailures = 0;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    // Lifecycle

    public StreamState getState() {
        return state;
    }

    /**
     * Start a new loop generation; ticks scheduled by older loops are discarded.
     */
    long beginLoop(ScheduledFutureFactory factory) {
        long generation = ++loopGeneration;
        state = StreamState.ACTIVE;
        consecutiveFailures = 0;
        loop = factory.schedule(generation);
        return generation;
    }

    boolean isCurrentLoop(long generation) {
        return !retired && state == StreamState.ACTIVE && loopGeneration == generation;
    }

    ScheduledFuture<?> getPendingStop() {
        return pendingStop;
    }

    void setPendingStop(ScheduledFuture<?> pendingStop) {
        this.pendingStop = pendingStop;
    }

    void cancelPendingStop() {
        if (pendingStop != null) {
            pendingStop.cancel(false);
            pendingStop = null;
        }
    }

    /**
     * Cancel the loop and any pending stop, close the history and mark the state retired.
     */
    void terminate() {
        state = StreamState.STOPPING;
        if (loop != null) {
            loop.cancel(false);
            loop = null;
        }
        cancelPendingStop();
        history.close();
        retired = true;
    }

    public boolean isRetired() {
        return retired;
    }

    @FunctionalInterface
    interface ScheduledFutureFactory {
        ScheduledFuture<?> schedule(long generation);
    }
}
