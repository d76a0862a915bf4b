package com.salesanalytics.ledger;

/**
 * One leaderboard row: how many calls an agent handled and how they went on average.
 *
 * @param agentId the agent
 * @param totalCalls number of recorded calls
 * @param avgSentiment mean customer sentiment in [-1, 1], null if no call was scored
 * @param avgTalkRatio mean share of talk time taken by the agent, null if never measured
 */
public record AgentPerformance(String agentId, long totalCalls, Double avgSentiment, Double avgTalkRatio) {
}
