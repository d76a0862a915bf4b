package com.salesanalytics.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.salesanalytics.recommendation.RecommendationResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for similar-call recommendations.
 *
 * Example JSON response:
 * <pre>
 * {
 *   "call_id": "call-001",
 *   "similar_calls": [
 *     {
 *       "call_id": "call-017",
 *       "agent_id": "agent-3",
 *       "similarity_score": 0.93,
 *       "supporting_snippet": "Agent: Thanks for calling, how can I help?",
 *       "customer_sentiment_score": 0.4,
 *       "start_time": "2024-01-15T10:30:00"
 *     }
 *   ],
 *   "coaching_nudges": [
 *     {"title": "Active Listening", "suggestion": "Ask more follow-up questions..."}
 *   ]
 * }
 * </pre>
 *
 * {@code similar_calls} is ordered by similarity, highest first.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RecommendationResponse {

    private String callId;

    private List<SimilarCallResponse> similarCalls;

    private List<CoachingNudgeResponse> coachingNudges;

    public static RecommendationResponse from(RecommendationResult result) {
        return RecommendationResponse.builder()
                .callId(result.callId())
                .similarCalls(result.similarCalls().stream().map(SimilarCallResponse::from).toList())
                .coachingNudges(result.coachingNudges().stream().map(CoachingNudgeResponse::from).toList())
                .build();
    }
}
