package com.salesanalytics.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.salesanalytics.recommendation.SimilarCall;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One ranked similar call.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SimilarCallResponse {

    private String callId;

    private String agentId;

    /**
     * Cosine similarity to the query call, in [-1, 1].
     */
    private double similarityScore;

    /**
     * First transcript line of the similar call, truncated.
     */
    private String supportingSnippet;

    private Double customerSentimentScore;

    private LocalDateTime startTime;

    public static SimilarCallResponse from(SimilarCall call) {
        return SimilarCallResponse.builder()
                .callId(call.callId())
                .agentId(call.agentId())
                .similarityScore(call.similarityScore())
                .supportingSnippet(call.supportingSnippet())
                .customerSentimentScore(call.customerSentimentScore())
                .startTime(call.startTime())
                .build();
    }
}
