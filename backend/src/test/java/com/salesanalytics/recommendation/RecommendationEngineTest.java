package com.salesanalytics.recommendation;

import com.salesanalytics.exception.CallNotFoundException;
import com.salesanalytics.exception.ErrorCode;
import com.salesanalytics.exception.RecommendationException;
import com.salesanalytics.ledger.CallLedger;
import com.salesanalytics.ledger.CorpusEntry;
import com.salesanalytics.ledger.EmbeddingVector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RecommendationEngine.
 *
 * Tests:
 * - Ranking by cosine similarity, most similar first
 * - Self exclusion, result size and the relevance floor
 * - Deterministic tie order
 * - Unknown call, missing embedding and empty corpus errors
 * - Corpus snapshot refresh
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RecommendationEngine Unit Tests")
class RecommendationEngineTest {

    private static final EmbeddingVector QUERY = EmbeddingVector.of(1.0, 0.0, 0.0);

    @Mock
    private CallLedger callLedger;

    private RecommendationEngine engine;

    @BeforeEach
    void setUp() {
        engine = new RecommendationEngine(callLedger, new CoachingNudgeCatalog(),
                Clock.fixed(Instant.parse("2024-01-15T10:30:00Z"), ZoneOffset.UTC));
    }

    private static CorpusEntry entry(String callId, double... embedding) {
        return new CorpusEntry(callId, "agent-" + callId, EmbeddingVector.of(embedding),
                "Customer: snippet of " + callId, 0.25, LocalDateTime.of(2024, 1, 10, 9, 0));
    }

    @Test
    @DisplayName("similar calls should be ranked most similar first, without the query call")
    void testRecommend_RanksBySimilarity() {
        // Arrange
        when(callLedger.getEmbedding("q")).thenReturn(Optional.of(QUERY));
        when(callLedger.getCorpus()).thenReturn(List.of(
                entry("q", 1.0, 0.0, 0.0),
                entry("far", 0.0, 1.0, 0.0),
                entry("near", 0.9, 0.1, 0.0),
                entry("opposite", -1.0, 0.0, 0.0),
                entry("mid", 0.5, 0.5, 0.0)));

        // Act
        RecommendationResult result = engine.recommend("q", 3);

        // Assert
        assertEquals("q", result.callId());
        assertEquals(List.of("near", "mid", "far"),
                result.similarCalls().stream().map(SimilarCall::callId).toList());
        SimilarCall best = result.similarCalls().get(0);
        assertEquals("agent-near", best.agentId());
        assertEquals("Customer: snippet of near", best.supportingSnippet());
        assertTrue(best.similarityScore() > 0.99);
        assertEquals(3, result.coachingNudges().size());
    }

    @Test
    @DisplayName("equal scores should keep corpus order")
    void testRecommend_StableTies() {
        // Arrange
        when(callLedger.getEmbedding("q")).thenReturn(Optional.of(QUERY));
        when(callLedger.getCorpus()).thenReturn(List.of(
                entry("b", 2.0, 0.0, 0.0),
                entry("a", 1.0, 0.0, 0.0),
                entry("c", 3.0, 0.0, 0.0)));

        // Act
        List<String> ids = engine.recommend("q", 3).similarCalls().stream().map(SimilarCall::callId).toList();

        // Assert
        assertEquals(List.of("b", "a", "c"), ids);
    }

    @Test
    @DisplayName("result size should be min(k, candidates) even for large k")
    void testRecommend_SizeIsMinOfKAndCorpus() {
        // Arrange
        List<CorpusEntry> corpus = new ArrayList<>();
        for (int i = 0; i < 80; i++) {
            corpus.add(entry("c" + i, 1.0, i / 80.0, 0.0));
        }
        when(callLedger.getEmbedding("q")).thenReturn(Optional.of(QUERY));
        when(callLedger.getCorpus()).thenReturn(corpus);

        // Act
        int belowCorpus = engine.recommend("q", 70).similarCalls().size();
        int aboveCorpus = engine.recommend("q", 120).similarCalls().size();

        // Assert
        assertEquals(70, belowCorpus);
        assertEquals(80, aboveCorpus);
    }

    @Test
    @DisplayName("k above the candidate count should return every candidate")
    void testRecommend_KAboveCandidates() {
        // Arrange
        when(callLedger.getEmbedding("q")).thenReturn(Optional.of(QUERY));
        when(callLedger.getCorpus()).thenReturn(List.of(
                entry("a", 1.0, 0.0, 0.0),
                entry("b", 1.0, 1.0, 0.0),
                entry("c", 0.0, 1.0, 0.0)));

        // Act & Assert
        assertEquals(3, engine.recommend("q", 10).similarCalls().size());
    }

    @Test
    @DisplayName("k below one should be rejected")
    void testRecommend_InvalidK() {
        assertThrows(IllegalArgumentException.class, () -> engine.recommend("q", 0));
        verifyNoInteractions(callLedger);
    }

    @Test
    @DisplayName("candidates below the relevance floor or of another dimension should be skipped")
    void testRecommend_FloorAndDimension() {
        // Arrange
        ReflectionTestUtils.setField(engine, "relevanceFloor", 0.0);
        when(callLedger.getEmbedding("q")).thenReturn(Optional.of(QUERY));
        when(callLedger.getCorpus()).thenReturn(List.of(
                entry("good", 1.0, 0.2, 0.0),
                entry("negative", -1.0, 0.2, 0.0),
                entry("wrong-dim", 1.0, 0.0)));

        // Act
        RecommendationResult result = engine.recommend("q", 5);

        // Assert
        assertEquals(List.of("good"), result.similarCalls().stream().map(SimilarCall::callId).toList());
    }

    @Test
    @DisplayName("unknown call should raise NOT_FOUND")
    void testRecommend_UnknownCall() {
        // Arrange
        when(callLedger.getEmbedding("ghost")).thenReturn(Optional.empty());
        when(callLedger.exists("ghost")).thenReturn(false);

        // Act
        CallNotFoundException exception = assertThrows(CallNotFoundException.class,
                () -> engine.recommend("ghost", 5));

        // Assert
        assertEquals(ErrorCode.NOT_FOUND, exception.getErrorCode());
        verify(callLedger, never()).getCorpus();
    }

    @Test
    @DisplayName("known call without an embedding should raise NOT_FOUND")
    void testRecommend_EmbeddingMissing() {
        // Arrange
        when(callLedger.getEmbedding("q")).thenReturn(Optional.empty());
        when(callLedger.exists("q")).thenReturn(true);

        // Act & Assert
        assertThrows(CallNotFoundException.class, () -> engine.recommend("q", 5));
    }

    @Test
    @DisplayName("corpus holding only the query call should raise NO_CORPUS")
    void testRecommend_NoCorpus() {
        // Arrange
        when(callLedger.getEmbedding("q")).thenReturn(Optional.of(QUERY));
        when(callLedger.getCorpus()).thenReturn(List.of(entry("q", 1.0, 0.0, 0.0)));

        // Act
        RecommendationException exception = assertThrows(RecommendationException.class,
                () -> engine.recommend("q", 5));

        // Assert
        assertEquals(ErrorCode.NO_CORPUS, exception.getErrorCode());
    }

    @Test
    @DisplayName("corpus should be loaded once and replaced only on refresh")
    void testRefreshCorpus_SwapsSnapshot() {
        // Arrange
        when(callLedger.getEmbedding("q")).thenReturn(Optional.of(QUERY));
        when(callLedger.getCorpus())
                .thenReturn(List.of(entry("a", 1.0, 0.0, 0.0)))
                .thenReturn(List.of(entry("a", 1.0, 0.0, 0.0), entry("b", 0.5, 0.5, 0.0)));

        // Act
        int before = engine.recommend("q", 5).similarCalls().size();
        int cached = engine.recommend("q", 5).similarCalls().size();
        engine.refreshCorpus();
        int after = engine.recommend("q", 5).similarCalls().size();

        // Assert
        assertEquals(1, before);
        assertEquals(1, cached);
        assertEquals(2, after);
        verify(callLedger, times(2)).getCorpus();
    }
}
