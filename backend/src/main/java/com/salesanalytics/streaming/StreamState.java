package com.salesanalytics.streaming;

/**
 * Lifecycle of one call's stream.
 *
 * IDLE -> ACTIVE on the first subscription, ACTIVE -> STOPPING on stop, and the
 * state is then removed from the registry. A call with no registered state is idle.
 */
public enum StreamState {
    IDLE,
    ACTIVE,
    STOPPING
}
