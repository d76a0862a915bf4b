package com.salesanalytics.sentiment;

/**
 * Raw output of the AI scorer.
 *
 * @param sentimentScore score in [-1, 1]
 * @param confidence confidence in [0, 1]
 * @param emotion emotion label, may be null when the model did not supply a known one
 */
public record SentimentScore(double sentimentScore, double confidence, Emotion emotion) {
}
