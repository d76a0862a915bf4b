package com.salesanalytics.recommendation;

import com.salesanalytics.ledger.CorpusEntry;

import java.time.Instant;
import java.util.List;

/**
 * Immutable copy of the comparison corpus, replaced wholesale on refresh.
 *
 * @param entries corpus entries in ledger order
 * @param loadedAt when the snapshot was taken
 */
public record CorpusSnapshot(List<CorpusEntry> entries, Instant loadedAt) {

    public CorpusSnapshot {
        entries = List.copyOf(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }
}
