package com.salesanalytics.recommendation;

import com.salesanalytics.exception.ErrorCode;
import com.salesanalytics.exception.RecommendationException;
import com.salesanalytics.ledger.EmbeddingVector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CosineSimilarity Unit Tests")
class CosineSimilarityTest {

    @Test
    @DisplayName("identical direction should score 1 and opposite direction -1")
    void testOf_Extremes() {
        // Arrange
        EmbeddingVector v = EmbeddingVector.of(0.3, -1.2, 4.0);

        // Act & Assert
        assertEquals(1.0, CosineSimilarity.of(v, EmbeddingVector.of(0.6, -2.4, 8.0)), 1e-12);
        assertEquals(-1.0, CosineSimilarity.of(v, v.negate()), 1e-12);
    }

    @Test
    @DisplayName("orthogonal vectors should score 0")
    void testOf_Orthogonal() {
        assertEquals(0.0, CosineSimilarity.of(EmbeddingVector.of(1, 0), EmbeddingVector.of(0, 5)), 1e-12);
    }

    @Test
    @DisplayName("zero vector should score 0 instead of NaN")
    void testOf_ZeroNorm() {
        assertEquals(0.0, CosineSimilarity.of(EmbeddingVector.of(0, 0), EmbeddingVector.of(1, 2)));
    }

    @Test
    @DisplayName("score should be symmetric and stay within [-1, 1]")
    void testOf_SymmetricAndBounded() {
        // Arrange
        EmbeddingVector a = EmbeddingVector.of(1e-3, 7.0, 0.1, 3.3);
        EmbeddingVector b = EmbeddingVector.of(1e-3, 7.0, 0.1, 3.3000000001);

        // Act
        double ab = CosineSimilarity.of(a, b);
        double ba = CosineSimilarity.of(b, a);

        // Assert
        assertEquals(ab, ba);
        assertTrue(ab <= 1.0 && ab >= -1.0);
    }

    @Test
    @DisplayName("different dimensions should be rejected")
    void testOf_DimensionMismatch() {
        // Act
        RecommendationException exception = assertThrows(RecommendationException.class,
                () -> CosineSimilarity.of(EmbeddingVector.of(1, 2), EmbeddingVector.of(1, 2, 3)));

        // Assert
        assertEquals(ErrorCode.DIMENSION_MISMATCH, exception.getErrorCode());
    }
}
