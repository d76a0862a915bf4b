package com.salesanalytics.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.salesanalytics.ledger.AgentPerformance;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for one agent on the leaderboard.
 *
 * Example JSON response:
 * <pre>
 * {
 *   "agent_id": "agent-3",
 *   "total_calls": 42,
 *   "avg_sentiment": 0.37,
 *   "avg_talk_ratio": 0.55
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AgentAnalyticsResponse {

    private String agentId;

    private long totalCalls;

    private Double avgSentiment;

    private Double avgTalkRatio;

    public static AgentAnalyticsResponse from(AgentPerformance performance) {
        return AgentAnalyticsResponse.builder()
                .agentId(performance.agentId())
                .totalCalls(performance.totalCalls())
                .avgSentiment(performance.avgSentiment())
                .avgTalkRatio(performance.avgTalkRatio())
                .build();
    }
}
