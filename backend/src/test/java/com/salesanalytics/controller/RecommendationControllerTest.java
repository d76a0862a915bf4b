package com.salesanalytics.controller;

import com.salesanalytics.exception.CallNotFoundException;
import com.salesanalytics.exception.GlobalExceptionHandler;
import com.salesanalytics.exception.RecommendationException;
import com.salesanalytics.recommendation.CoachingNudge;
import com.salesanalytics.recommendation.RecommendationEngine;
import com.salesanalytics.recommendation.RecommendationResult;
import com.salesanalytics.recommendation.SimilarCall;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDateTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web layer tests for RecommendationController.
 *
 * Tests:
 * - Snake_case response body and default k
 * - Error mapping to RFC 7807 responses (404, 409, 400)
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RecommendationController Tests")
class RecommendationControllerTest {

    @Mock
    private RecommendationEngine recommendationEngine;

    @InjectMocks
    private RecommendationController controller;

    private MockMvc mockMvc;

    private final UsernamePasswordAuthenticationToken manager =
            new UsernamePasswordAuthenticationToken("manager-1", null, List.of());

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("recommendations should be returned with snake_case fields")
    void testGetRecommendations_Success() throws Exception {
        // Arrange
        RecommendationResult result = new RecommendationResult(
                "call-1",
                List.of(new SimilarCall("call-7", "agent-3", 0.93, "Customer: hi", 0.4,
                        LocalDateTime.of(2024, 1, 15, 10, 30))),
                List.of(CoachingNudge.of("Active Listening", "Ask more follow-up questions.")));
        when(recommendationEngine.recommend("call-1", 5)).thenReturn(result);

        // Act & Assert
        mockMvc.perform(get("/api/v1/calls/call-1/recommendations").principal(manager))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.call_id").value("call-1"))
                .andExpect(jsonPath("$.similar_calls[0].call_id").value("call-7"))
                .andExpect(jsonPath("$.similar_calls[0].similarity_score").value(0.93))
                .andExpect(jsonPath("$.similar_calls[0].supporting_snippet").value("Customer: hi"))
                .andExpect(jsonPath("$.coaching_nudges[0].title").value("Active Listening"));
    }

    @Test
    @DisplayName("explicit k should be passed to the engine")
    void testGetRecommendations_ExplicitK() throws Exception {
        // Arrange
        when(recommendationEngine.recommend("call-1", 2))
                .thenReturn(new RecommendationResult("call-1", List.of(), List.of()));

        // Act & Assert
        mockMvc.perform(get("/api/v1/calls/call-1/recommendations").param("k", "2").principal(manager))
                .andExpect(status().isOk());
        verify(recommendationEngine).recommend("call-1", 2);
    }

    @Test
    @DisplayName("unknown call should map to 404")
    void testGetRecommendations_NotFound() throws Exception {
        // Arrange
        when(recommendationEngine.recommend("ghost", 5)).thenThrow(CallNotFoundException.forCall("ghost"));

        // Act & Assert
        mockMvc.perform(get("/api/v1/calls/ghost/recommendations").principal(manager))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.title").value("Call Not Found"));
    }

    @Test
    @DisplayName("empty corpus should map to 409")
    void testGetRecommendations_NoCorpus() throws Exception {
        // Arrange
        when(recommendationEngine.recommend("call-1", 5)).thenThrow(RecommendationException.noCorpus());

        // Act & Assert
        mockMvc.perform(get("/api/v1/calls/call-1/recommendations").principal(manager))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("k below one should map to 400")
    void testGetRecommendations_InvalidK() throws Exception {
        // Arrange
        when(recommendationEngine.recommend("call-1", 0))
                .thenThrow(new IllegalArgumentException("k must be at least 1, got 0"));

        // Act & Assert
        mockMvc.perform(get("/api/v1/calls/call-1/recommendations").param("k", "0").principal(manager))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("non-numeric k should map to 400 without reaching the engine")
    void testGetRecommendations_NonNumericK() throws Exception {
        // Act & Assert
        mockMvc.perform(get("/api/v1/calls/call-1/recommendations").param("k", "many").principal(manager))
                .andExpect(status().isBadRequest());
        verify(recommendationEngine, never()).recommend(anyString(), anyInt());
    }
}
