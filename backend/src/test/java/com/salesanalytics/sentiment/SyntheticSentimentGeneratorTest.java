package com.salesanalytics.sentiment;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SyntheticSentimentGenerator Unit Tests")
class SyntheticSentimentGeneratorTest {

    private final SyntheticSentimentGenerator generator = new SyntheticSentimentGenerator();

    @Test
    @DisplayName("samples should be flagged synthetic with the capped confidence")
    void testGenerate_FlagsSynthetic() {
        // Act
        SentimentSample sample = generator.generate("call-1", Instant.parse("2024-01-15T10:30:00Z"));

        // Assert
        assertTrue(sample.isSynthetic());
        assertEquals(SyntheticSentimentGenerator.SYNTHETIC_CONFIDENCE, sample.getConfidence());
        assertEquals("call-1", sample.getCallId());
        assertEquals(Emotion.fromScore(sample.getSentimentScore()), sample.getEmotion());
    }

    @Test
    @DisplayName("same call and time should give the same score")
    void testGenerate_Deterministic() {
        // Arrange
        Instant time = Instant.parse("2024-01-15T10:30:07Z");

        // Act & Assert
        assertEquals(
                generator.generate("call-1", time).getSentimentScore(),
                generator.generate("call-1", time).getSentimentScore());
    }

    @Test
    @DisplayName("scores should oscillate within the amplitude")
    void testGenerate_OscillatesWithinAmplitude() {
        // Arrange
        Instant start = Instant.parse("2024-01-15T10:30:00Z");
        Set<Double> seen = new HashSet<>();

        // Act
        for (int second = 0; second < 60; second += 2) {
            double score = generator.generate("call-1", start.plusSeconds(second)).getSentimentScore();
            assertTrue(Math.abs(score) <= 0.8 + 1e-9, "score out of amplitude: " + score);
            seen.add(score);
        }

        // Assert
        assertTrue(seen.size() > 10);
    }
}
