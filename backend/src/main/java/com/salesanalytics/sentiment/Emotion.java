package com.salesanalytics.sentiment;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Coarse emotion label attached to every sentiment sample.
 */
public enum Emotion {

    VERY_POSITIVE("very_positive"),
    POSITIVE("positive"),
    NEUTRAL("neutral"),
    NEGATIVE("negative"),
    VERY_NEGATIVE("very_negative");

    private final String label;

    Emotion(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Label for a sentiment score in [-1, 1].
     */
    public static Emotion fromScore(double score) {
        if (score >= 0.6) {
            return VERY_POSITIVE;
        } else if (score >= 0.2) {
            return POSITIVE;
        } else if (score >= -0.2) {
            return NEUTRAL;
        } else if (score >= -0.6) {
            return NEGATIVE;
        }
        return VERY_NEGATIVE;
    }

    /**
     * Parses a label as returned by the AI scorer ({@code "very positive"}, {@code "NEGATIVE"}, ...).
     */
    public static Optional<Emotion> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String normalized = label.trim().toLowerCase().replace(' ', '_').replace('-', '_');
        return Arrays.stream(values())
                .filter(emotion -> emotion.label.equals(normalized))
                .findFirst();
    }
}
