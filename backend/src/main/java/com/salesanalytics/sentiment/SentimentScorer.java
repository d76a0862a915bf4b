package com.salesanalytics.sentiment;

import com.salesanalytics.exception.ProcessingException;

/**
 * External AI scorer producing the current sentiment of a live call.
 */
public interface SentimentScorer {

    /**
     * @param callId the call to score
     * @return the current score
     * @throws ProcessingException if the scorer is unavailable or its answer is unusable
     */
    SentimentScore score(String callId);

    default void release(String callId) {
    }
}
