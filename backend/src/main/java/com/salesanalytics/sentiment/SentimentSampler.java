package com.salesanalytics.sentiment;

import com.salesanalytics.exception.ProcessingException;

/**
 * Produces one sentiment observation per tick for an active call stream.
 *
 * Implementations never touch stream state; the stream controller is the only
 * writer of a call's history.
 */
public interface SentimentSampler {

    /**
     * @param callId the streamed call
     * @return a fresh sample (sequence not yet assigned)
     * @throws ProcessingException if no sample can be produced for this tick
     */
    SentimentSample sample(String callId);

    /**
     * Drop any per-call state once the call's stream has stopped.
     */
    default void release(String callId) {
    }
}
