package com.salesanalytics.exception;

/**
 * Exception thrown by the recommendation engine when similarity search cannot run.
 */
public class RecommendationException extends AnalyticsException {

    public RecommendationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    /**
     * Constructs a new RecommendationException for an empty comparison corpus.
     *
     * @return a RecommendationException with a formatted message
     */
    public static RecommendationException noCorpus() {
        return new RecommendationException(
                ErrorCode.NO_CORPUS,
                "No historical calls with embeddings are available to compare against."
        );
    }

    /**
     * Constructs a new RecommendationException for vectors of different dimension.
     *
     * @param left dimension of the first vector
     * @param right dimension of the second vector
     * @return a RecommendationException with a formatted message
     */
    public static RecommendationException dimensionMismatch(int left, int right) {
        return new RecommendationException(
                ErrorCode.DIMENSION_MISMATCH,
                String.format("Embedding dimensions differ (%d vs %d); similarity is undefined.", left, right)
        );
    }
}
