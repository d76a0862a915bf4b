package com.salesanalytics.sentiment;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * One sentiment observation for a live call.
 *
 * Immutable once created. The sampler fills in the score fields; the stream
 * controller assigns {@code sequence} (the call's tick number, starting at 1)
 * and the final {@code timestamp} before the sample enters the history.
 *
 * Serialized with snake_case names, e.g.
 * <pre>
 * {
 *   "call_id": "call-001",
 *   "sequence": 7,
 *   "timestamp": "2024-01-15T10:30:05Z",
 *   "sentiment_score": 0.42,
 *   "confidence": 0.88,
 *   "emotion": "positive",
 *   "intensity": 0.42,
 *   "synthetic": false
 * }
 * </pre>
 */
@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SentimentSample {

    String callId;

    @With
    long sequence;

    @With
    Instant timestamp;

    double sentimentScore;

    double confidence;

    Emotion emotion;

    double intensity;

    /**
     * True when the value comes from the synthetic generator rather than the AI scorer.
     */
    boolean synthetic;

    /**
     * Create a sample, clamping values into their ranges.
     *
     * @param callId the call identifier
     * @param timestamp observation time
     * @param sentimentScore score, clamped to [-1, 1]
     * @param confidence confidence, clamped to [0, 1]
     * @param emotion emotion label, derived from the score when null
     * @param intensity independent intensity in [0, 1], or null for |score|
     * @param synthetic whether the sample is synthetic
     * @return the sample, with sequence 0 until the controller assigns one
     */
    public static SentimentSample create(String callId, Instant timestamp, double sentimentScore,
                                         double confidence, Emotion emotion, Double intensity,
                                         boolean synthetic) {
        double score = clamp(sentimentScore, -1.0, 1.0);
        double resolvedIntensity = intensity != null ? clamp(intensity, 0.0, 1.0) : Math.abs(score);
        return new SentimentSample(
                callId,
                0L,
                timestamp,
                score,
                clamp(confidence, 0.0, 1.0),
                emotion != null ? emotion : Emotion.fromScore(score),
                resolvedIntensity,
                synthetic
        );
    }

    private static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(min, Math.min(max, value));
    }
}
