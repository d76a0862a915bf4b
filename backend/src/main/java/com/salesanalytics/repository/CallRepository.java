package com.salesanalytics.repository;

import com.salesanalytics.entity.Call;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read access to recorded calls.
 */
@Repository
public interface CallRepository extends JpaRepository<Call, UUID> {

    Optional<Call> findByCallId(String callId);

    boolean existsByCallId(String callId);

    /**
     * Calls that already carry an embedding, oldest first so that corpus order is stable.
     */
    @Query("SELECT c FROM Call c WHERE c.embeddings IS NOT NULL ORDER BY c.startTime ASC, c.callId ASC")
    List<Call> findAllWithEmbeddings();

    /**
     * Call count and metric averages per agent. AVG ignores null metrics.
     */
    @Query("SELECT c.agentId AS agentId, COUNT(c) AS totalCalls, "
            + "AVG(c.customerSentimentScore) AS avgSentiment, AVG(c.agentTalkRatio) AS avgTalkRatio "
            + "FROM Call c GROUP BY c.agentId")
    List<AgentCallStats> aggregateByAgent();
}
