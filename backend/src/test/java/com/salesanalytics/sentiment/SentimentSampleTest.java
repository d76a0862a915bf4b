package com.salesanalytics.sentiment;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SentimentSample and Emotion Unit Tests")
class SentimentSampleTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:30:00Z");

    @Test
    @DisplayName("create should clamp score and confidence into range")
    void testCreate_ClampsValues() {
        // Act
        SentimentSample high = SentimentSample.create("call-1", NOW, 1.7, 1.2, null, null, false);
        SentimentSample low = SentimentSample.create("call-1", NOW, -3.0, -0.5, null, null, false);

        // Assert
        assertEquals(1.0, high.getSentimentScore());
        assertEquals(1.0, high.getConfidence());
        assertEquals(-1.0, low.getSentimentScore());
        assertEquals(0.0, low.getConfidence());
    }

    @Test
    @DisplayName("create should derive emotion and intensity from the score when not supplied")
    void testCreate_DerivesEmotionAndIntensity() {
        // Act
        SentimentSample sample = SentimentSample.create("call-1", NOW, -0.45, 0.9, null, null, false);

        // Assert
        assertEquals(Emotion.NEGATIVE, sample.getEmotion());
        assertEquals(0.45, sample.getIntensity(), 1e-9);
        assertEquals(0L, sample.getSequence());
        assertFalse(sample.isSynthetic());
    }

    @Test
    @DisplayName("create should keep a supplied emotion and intensity")
    void testCreate_KeepsSuppliedValues() {
        // Act
        SentimentSample sample = SentimentSample.create("call-1", NOW, 0.1, 0.9, Emotion.POSITIVE, 0.7, true);

        // Assert
        assertEquals(Emotion.POSITIVE, sample.getEmotion());
        assertEquals(0.7, sample.getIntensity(), 1e-9);
        assertTrue(sample.isSynthetic());
    }

    @Test
    @DisplayName("fromScore should follow the label thresholds")
    void testEmotionFromScore() {
        assertEquals(Emotion.VERY_POSITIVE, Emotion.fromScore(0.6));
        assertEquals(Emotion.POSITIVE, Emotion.fromScore(0.2));
        assertEquals(Emotion.NEUTRAL, Emotion.fromScore(0.0));
        assertEquals(Emotion.NEUTRAL, Emotion.fromScore(-0.2));
        assertEquals(Emotion.NEGATIVE, Emotion.fromScore(-0.6));
        assertEquals(Emotion.VERY_NEGATIVE, Emotion.fromScore(-0.61));
    }

    @Test
    @DisplayName("fromLabel should accept loosely formatted labels")
    void testEmotionFromLabel() {
        assertEquals(Emotion.VERY_POSITIVE, Emotion.fromLabel("Very Positive").orElseThrow());
        assertEquals(Emotion.NEGATIVE, Emotion.fromLabel(" NEGATIVE ").orElseThrow());
        assertTrue(Emotion.fromLabel("ecstatic").isEmpty());
        assertTrue(Emotion.fromLabel(null).isEmpty());
    }

    @Test
    @DisplayName("sample should serialize with snake_case names and emotion labels")
    void testSerialization() throws Exception {
        // Arrange
        ObjectMapper objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        SentimentSample sample = SentimentSample.create("call-1", NOW, 0.7, 0.8, null, null, false)
                .withSequence(3);

        // Act
        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(sample));

        // Assert
        assertEquals("call-1", json.get("call_id").asText());
        assertEquals(3, json.get("sequence").asLong());
        assertEquals("2024-01-15T10:30:00Z", json.get("timestamp").asText());
        assertEquals(0.7, json.get("sentiment_score").asDouble(), 1e-9);
        assertEquals("very_positive", json.get("emotion").asText());
        assertFalse(json.get("synthetic").asBoolean());
    }
}
