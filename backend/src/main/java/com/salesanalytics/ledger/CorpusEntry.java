package com.salesanalytics.ledger;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One historical call available for similarity search.
 *
 * @param callId call identifier
 * @param agentId agent who handled the call
 * @param embedding transcript embedding
 * @param snippet short excerpt shown next to a recommendation
 * @param customerSentimentScore whole-call customer sentiment, may be null
 * @param startTime when the call started, may be null
 */
public record CorpusEntry(
        String callId,
        String agentId,
        EmbeddingVector embedding,
        String snippet,
        Double customerSentimentScore,
        LocalDateTime startTime
) {

    public CorpusEntry {
        Objects.requireNonNull(callId, "callId");
        Objects.requireNonNull(embedding, "embedding");
    }
}
