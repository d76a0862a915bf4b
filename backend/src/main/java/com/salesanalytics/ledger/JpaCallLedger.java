package com.salesanalytics.ledger;

import com.salesanalytics.entity.Call;
import com.salesanalytics.repository.AgentCallStats;
import com.salesanalytics.repository.CallRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * {@link CallLedger} backed by the {@code calls} table.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaCallLedger implements CallLedger {

    static final int SNIPPET_MAX_LENGTH = 160;

    static final Comparator<AgentPerformance> LEADERBOARD_ORDER = Comparator
            .<AgentPerformance, Double>comparing(AgentPerformance::avgSentiment,
                    Comparator.nullsLast(Comparator.<Double>reverseOrder()))
            .thenComparing(AgentPerformance::agentId);

    private final CallRepository callRepository;

    @Override
    public boolean exists(String callId) {
        if (callId == null || callId.isBlank()) {
            return false;
        }
        return callRepository.existsByCallId(callId);
    }

    @Override
    public Optional<EmbeddingVector> getEmbedding(String callId) {
        return callRepository.findByCallId(callId)
                .map(Call::getEmbeddings)
                .filter(embeddings -> !embeddings.isEmpty())
                .map(EmbeddingVector::of);
    }

    @Override
    public Optional<String> getTranscript(String callId) {
        return callRepository.findByCallId(callId).map(Call::getTranscript);
    }

    @Override
    public List<CorpusEntry> getCorpus() {
        List<Call> calls = callRepository.findAllWithEmbeddings();
        List<CorpusEntry> corpus = new ArrayList<>(calls.size());

        for (Call call : calls) {
            if (call.getEmbeddings() == null || call.getEmbeddings().isEmpty()) {
                continue;
            }
            try {
                corpus.add(new CorpusEntry(
                        call.getCallId(),
                        call.getAgentId(),
                        EmbeddingVector.of(call.getEmbeddings()),
                        snippet(call.getTranscript()),
                        call.getCustomerSentimentScore(),
                        call.getStartTime()
                ));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping call {} with unusable embedding: {}", call.getCallId(), e.getMessage());
            }
        }

        log.debug("Loaded corpus of {} calls ({} rows with embeddings)", corpus.size(), calls.size());
        return corpus;
    }

    @Override
    public List<AgentPerformance> getAgentLeaderboard() {
        List<AgentCallStats> rows = callRepository.aggregateByAgent();
        List<AgentPerformance> leaderboard = rows.stream()
                .map(row -> new AgentPerformance(
                        row.getAgentId(),
                        row.getTotalCalls(),
                        row.getAvgSentiment(),
                        row.getAvgTalkRatio()))
                .sorted(LEADERBOARD_ORDER)
                .toList();

        log.debug("Built leaderboard for {} agents", leaderboard.size());
        return leaderboard;
    }

    /**
     * First non-blank transcript line, whitespace collapsed, cut to {@value #SNIPPET_MAX_LENGTH} chars.
     */
    static String snippet(String transcript) {
        if (transcript == null) {
            return "";
        }
        for (String line : transcript.split("\\R")) {
            String normalized = line.trim().replaceAll("\\s+", " ");
            if (!normalized.isEmpty()) {
                if (normalized.length() > SNIPPET_MAX_LENGTH) {
                    return normalized.substring(0, SNIPPET_MAX_LENGTH - 3) + "...";
                }
                return normalized;
            }
        }
        return "";
    }
}
