package com.salesanalytics.recommendation;

import com.salesanalytics.exception.CallNotFoundException;
import com.salesanalytics.exception.RecommendationException;
import com.salesanalytics.ledger.CallLedger;
import com.salesanalytics.ledger.CorpusEntry;
import com.salesanalytics.ledger.EmbeddingVector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Service for finding historical calls similar to a given call.
 *
 * Ranks every call of the comparison corpus by cosine similarity of its embedding
 * to the query call's embedding and returns the top {@code k}, together with a
 * deterministic set of coaching nudges.
 *
 * Ranking rules:
 * - The query call itself is not a candidate (configurable)
 * - Candidates whose embedding dimension differs from the query are skipped
 * - Candidates below {@code app.recommendations.relevance-floor} are dropped
 * - Ties keep corpus order, so the same query against the same snapshot always
 *   yields the same result
 *
 * The corpus is an immutable snapshot swapped in atomically by {@link #refreshCorpus()};
 * readers never lock and never observe a half-built corpus.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RecommendationEngine {

    private final CallLedger callLedger;
    private final CoachingNudgeCatalog nudgeCatalog;
    private final Clock clock;

    @Value("${app.recommendations.exclude-self:true}")
    private boolean excludeSelf = true;

    @Value("${app.recommendations.relevance-floor:-1.0}")
    private double relevanceFloor = -1.0;

    private final AtomicReference<CorpusSnapshot> snapshot = new AtomicReference<>();

    /**
     * Rank the corpus against a call.
     *
     * @param callId the query call
     * @param k maximum number of similar calls, at least 1
     * @return similar calls, most similar first; {@code min(k, candidates)} of them
     * @throws IllegalArgumentException if {@code k < 1}
     * @throws CallNotFoundException if the call or its embedding is unknown
     * @throws RecommendationException with {@code NO_CORPUS} if there is nothing to compare against
     */
    public RecommendationResult recommend(String callId, int k) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be at least 1, got " + k);
        }

        EmbeddingVector query = callLedger.getEmbedding(callId)
                .orElseThrow(() -> callLedger.exists(callId)
                        ? CallNotFoundException.embeddingMissing(callId)
                        : CallNotFoundException.forCall(callId));

        List<CorpusEntry> corpus = currentCorpus().entries().stream()
                .filter(entry -> !(excludeSelf && entry.callId().equals(callId)))
                .toList();
        if (corpus.isEmpty()) {
            log.warn("No corpus to rank call {} against", callId);
            throw RecommendationException.noCorpus();
        }

        List<SimilarCall> ranked = new ArrayList<>(corpus.size());
        for (CorpusEntry entry : corpus) {
            if (entry.embedding().dimension() != query.dimension()) {
                log.debug("Skipping {}: embedding dimension {} does not match {}",
                        entry.callId(), entry.embedding().dimension(), query.dimension());
                continue;
            }
            double similarity = CosineSimilarity.of(query, entry.embedding());
            if (similarity < relevanceFloor) {
                continue;
            }
            ranked.add(new SimilarCall(
                    entry.callId(),
                    entry.agentId(),
                    similarity,
                    entry.snippet(),
                    entry.customerSentimentScore(),
                    entry.startTime()));
        }

        // List.sort is stable: equal scores keep corpus order
        ranked.sort(Comparator.comparingDouble(SimilarCall::similarityScore).reversed());
        List<SimilarCall> top = ranked.subList(0, Math.min(k, ranked.size()));

        log.info("Ranked {} candidates for call {}, returning {}", ranked.size(), callId, top.size());
        return new RecommendationResult(callId, top, nudgeCatalog.nudgesFor(callId));
    }

    /**
     * Reload the corpus from the ledger and swap it in.
     */
    @Scheduled(
            initialDelayString = "${app.recommendations.corpus-refresh-interval:PT5M}",
            fixedDelayString = "${app.recommendations.corpus-refresh-interval:PT5M}"
    )
    public void refreshCorpus() {
        loadCorpus();
    }

    /**
     * The current snapshot, loading it on first use.
     */
    CorpusSnapshot currentCorpus() {
        CorpusSnapshot current = snapshot.get();
        return current != null ? current : loadCorpus();
    }

    private CorpusSnapshot loadCorpus() {
        CorpusSnapshot fresh = new CorpusSnapshot(callLedger.getCorpus(), clock.instant());
        CorpusSnapshot previous = snapshot.getAndSet(fresh);
        log.info("Loaded recommendation corpus: {} calls (previously {})",
                fresh.size(), previous == null ? "not loaded" : previous.size());
        return fresh;
    }
}
