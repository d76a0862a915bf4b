package com.salesanalytics.recommendation;

import com.salesanalytics.exception.RecommendationException;
import com.salesanalytics.ledger.EmbeddingVector;

/**
 * Cosine similarity of two embeddings.
 */
public final class CosineSimilarity {

    private CosineSimilarity() {
    }

    /**
     * @return {@code a·b / (|a| |b|)} clamped to [-1, 1], or 0 when either vector has zero norm
     * @throws RecommendationException with {@code DIMENSION_MISMATCH} if the dimensions differ
     */
    public static double of(EmbeddingVector a, EmbeddingVector b) {
        if (a.dimension() != b.dimension()) {
            throw RecommendationException.dimensionMismatch(a.dimension(), b.dimension());
        }
        double normA = a.norm();
        double normB = b.norm();
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }

        double dot = 0.0;
        for (int i = 0; i < a.dimension(); i++) {
            dot += a.get(i) * b.get(i);
        }
        double similarity = dot / (normA * normB);
        // floating point can overshoot by an ulp or two
        return Math.max(-1.0, Math.min(1.0, similarity));
    }
}
