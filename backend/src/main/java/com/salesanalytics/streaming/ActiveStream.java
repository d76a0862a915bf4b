package com.salesanalytics.streaming;

/**
 * Point-in-time view of one call's stream.
 *
 * @param callId the streamed call
 * @param state current lifecycle state
 * @param subscribers number of admitted sessions
 * @param historySize samples currently retained
 * @param lastSequence sequence number of the latest sample, 0 before the first tick
 */
public record ActiveStream(String callId, StreamState state, int subscribers, int historySize, long lastSequence) {
}
