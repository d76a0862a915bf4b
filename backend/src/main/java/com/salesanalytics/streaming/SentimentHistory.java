package com.salesanalytics.streaming;

import com.salesanalytics.sentiment.SentimentSample;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Bounded FIFO of a call's most recent samples.
 *
 * Not thread-safe; always accessed under the owning call's lock.
 */
public class SentimentHistory {

    private final int capacity;
    private final Deque<SentimentSample> samples;
    private boolean closed;

    public SentimentHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("History capacity must be at least 1, got " + capacity);
        }
        this.capacity = capacity;
        this.samples = new ArrayDeque<>(Math.min(capacity, 256));
    }

    /**
     * Append a sample, evicting the oldest one when full.
     *
     * @return false if the history has been closed and the sample was discarded
     */
    public boolean append(SentimentSample sample) {
        if (closed) {
            return false;
        }
        if (samples.size() == capacity) {
            samples.removeFirst();
        }
        samples.addLast(sample);
        return true;
    }

    /**
     * Samples oldest first.
     */
    public List<SentimentSample> snapshot() {
        return List.copyOf(samples);
    }

    public int size() {
        return samples.size();
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    public int capacity() {
        return capacity;
    }

    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }
}
