package com.salesanalytics.ledger;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to recorded calls, their transcripts and embeddings.
 *
 * The ledger is owned by the ingestion side of the system; the streaming and
 * recommendation core never writes through it.
 */
public interface CallLedger {

    boolean exists(String callId);

    /**
     * @return the call's embedding, or empty if the call is unknown or not yet analyzed
     */
    Optional<EmbeddingVector> getEmbedding(String callId);

    /**
     * @return the call's transcript, or empty if the call is unknown
     */
    Optional<String> getTranscript(String callId);

    /**
     * All calls with embeddings, in a stable order.
     */
    List<CorpusEntry> getCorpus();

    /**
     * Per-agent call count and averages, best average customer sentiment first.
     * Agents without any sentiment score come last; ties are ordered by agent id.
     */
    List<AgentPerformance> getAgentLeaderboard();
}
