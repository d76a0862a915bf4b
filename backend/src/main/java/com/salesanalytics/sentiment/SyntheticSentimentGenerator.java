package com.salesanalytics.sentiment;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Deterministic stand-in for the AI scorer.
 *
 * Produces a sine wave per call: {@code amplitude * sin(2πt / period + phase)}, where
 * {@code t} is the sample time in seconds and the phase is derived from the call id.
 * Confidence is pinned at {@link #SYNTHETIC_CONFIDENCE} and every sample is flagged
 * {@code synthetic}, so consumers can tell it apart from a genuine score.
 */
@Component
public class SyntheticSentimentGenerator {

    public static final double SYNTHETIC_CONFIDENCE = 0.5;

    @Value("${app.streaming.sampler.synthetic-amplitude:0.8}")
    private double amplitude = 0.8;

    @Value("${app.streaming.sampler.synthetic-period-seconds:60}")
    private double periodSeconds = 60;

    public SentimentSample generate(String callId, Instant timestamp) {
        double seconds = timestamp.getEpochSecond() + timestamp.getNano() / 1_000_000_000.0;
        double score = amplitude * Math.sin(2 * Math.PI * seconds / periodSeconds + phase(callId));

        return SentimentSample.create(
                callId,
                timestamp,
                score,
                SYNTHETIC_CONFIDENCE,
                null,
                null,
                true
        );
    }

    private static double phase(String callId) {
        return Math.floorMod(callId.hashCode(), 360) * Math.PI / 180.0;
    }
}
