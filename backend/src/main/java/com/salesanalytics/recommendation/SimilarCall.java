package com.salesanalytics.recommendation;

import java.time.LocalDateTime;

/**
 * A historical call ranked against the query call.
 */
public record SimilarCall(
        String callId,
        String agentId,
        double similarityScore,
        String supportingSnippet,
        Double customerSentimentScore,
        LocalDateTime startTime
) {
}
