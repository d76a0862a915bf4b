package com.salesanalytics.streaming;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the {@link CallStreamState} of every call that currently has a stream.
 *
 * Lookups never lock; each state carries its own lock and different calls never
 * contend. A state is created lazily by the first admission and leaves the map
 * only through {@link #retire(CallStreamState)}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CallStreamRegistry {

    private final StreamingProperties properties;

    private final Map<String, CallStreamState> streams = new ConcurrentHashMap<>();

    /**
     * Get or create the state of a call and return it locked.
     *
     * The caller must {@link CallStreamState#unlock()} it. Never returns a retired state.
     */
    public CallStreamState acquire(String callId) {
        while (true) {
            CallStreamState state = streams.computeIfAbsent(callId,
                    id -> new CallStreamState(id, properties.getHistorySize()));
            state.lock();
            if (!state.isRetired()) {
                return state;
            }
            state.unlock();
        }
    }

    public Optional<CallStreamState> find(String callId) {
        return Optional.ofNullable(streams.get(callId));
    }

    public List<CallStreamState> all() {
        return new ArrayList<>(streams.values());
    }

    public int size() {
        return streams.size();
    }

    /**
     * Terminate a state and remove it from the registry. Caller holds the state's lock.
     */
    void retire(CallStreamState state) {
        state.terminate();
        streams.remove(state.getCallId(), state);
    }

    /**
     * Force-stop every stream, notify its subscribers and close their connections.
     *
     * Normally the stream controller has already stopped everything by the time this
     * runs; whatever is left is torn down here.
     */
    @PreDestroy
    public void teardown() {
        List<CallStreamState> remaining = all();
        if (!remaining.isEmpty()) {
            log.info("Tearing down {} remaining call streams", remaining.size());
        }
        StreamMessage notice = StreamMessage.streamStopped(StopReason.SHUTDOWN);
        for (CallStreamState state : remaining) {
            state.lock();
            try {
                if (state.isRetired()) {
                    continue;
                }
                for (StreamSession session : state.subscribers()) {
                    StreamConnection connection = session.getConnection();
                    try {
                        connection.send(notice);
                    } catch (IOException e) {
                        log.debug("Could not notify session {} of shutdown: {}", session.getId(), e.getMessage());
                    }
                    connection.close(StreamConnection.CloseCode.GOING_AWAY);
                }
                state.clearSubscribers();
                retire(state);
            } finally {
                state.unlock();
            }
        }
        streams.clear();
    }
}
