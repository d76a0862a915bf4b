package com.salesanalytics.repository;

/**
 * Per-agent aggregate row of the {@code calls} table.
 *
 * Averages are null when none of the agent's calls carries the metric.
 */
public interface AgentCallStats {

    String getAgentId();

    Long getTotalCalls();

    Double getAvgSentiment();

    Double getAvgTalkRatio();
}
