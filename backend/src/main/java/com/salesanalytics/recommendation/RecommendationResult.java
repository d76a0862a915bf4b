package com.salesanalytics.recommendation;

import java.util.List;

/**
 * Ranked similar calls for one query call, most similar first.
 */
public record RecommendationResult(String callId, List<SimilarCall> similarCalls, List<CoachingNudge> coachingNudges) {

    public RecommendationResult {
        similarCalls = List.copyOf(similarCalls);
        coachingNudges = List.copyOf(coachingNudges);
    }
}
