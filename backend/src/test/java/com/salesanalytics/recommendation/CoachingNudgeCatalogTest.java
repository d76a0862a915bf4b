package com.salesanalytics.recommendation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CoachingNudgeCatalog Unit Tests")
class CoachingNudgeCatalogTest {

    private final CoachingNudgeCatalog catalog = new CoachingNudgeCatalog();

    @Test
    @DisplayName("same call should always get the same distinct nudges")
    void testNudgesFor_Deterministic() {
        // Act
        List<CoachingNudge> first = catalog.nudgesFor("call-42");
        List<CoachingNudge> second = catalog.nudgesFor("call-42");

        // Assert
        assertEquals(first, second);
        assertEquals(CoachingNudgeCatalog.NUDGES_PER_CALL, first.size());
        assertEquals(first.size(), new HashSet<>(first).size());
        assertTrue(catalog.catalog().containsAll(first));
    }

    @Test
    @DisplayName("catalog suggestions should fit the length limit")
    void testCatalog_SuggestionLength() {
        catalog.catalog().forEach(nudge ->
                assertTrue(nudge.suggestion().length() <= CoachingNudge.MAX_SUGGESTION_LENGTH, nudge.title()));
    }

    @Test
    @DisplayName("long suggestions should be cut with an ellipsis")
    void testNudgeOf_Truncates() {
        // Act
        CoachingNudge nudge = CoachingNudge.of("Long", "x".repeat(150));

        // Assert
        assertEquals(CoachingNudge.MAX_SUGGESTION_LENGTH, nudge.suggestion().length());
        assertTrue(nudge.suggestion().endsWith("..."));
    }
}
