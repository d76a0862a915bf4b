package com.salesanalytics.controller;

import com.salesanalytics.dto.response.RecommendationResponse;
import com.salesanalytics.recommendation.RecommendationEngine;
import com.salesanalytics.recommendation.RecommendationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST Controller for similar-call recommendations.
 *
 * Endpoints:
 * - GET /api/v1/calls/{callId}/recommendations?k=5 - Top-k similar calls plus coaching nudges
 *
 * Error Responses (RFC 7807 via GlobalExceptionHandler):
 * - 400 Bad Request: k below 1 or not a number
 * - 401 Unauthorized: missing or invalid token
 * - 404 Not Found: unknown call, or call without an embedding
 * - 409 Conflict: no other calls to compare against
 *
 * @see com.salesanalytics.recommendation.RecommendationEngine
 */
@RestController
@RequestMapping("/api/v1/calls")
@RequiredArgsConstructor
@Slf4j
public class RecommendationController {

    static final String DEFAULT_K = "5";

    private final RecommendationEngine recommendationEngine;

    /**
     * Get calls similar to the given call, with coaching nudges.
     *
     * @param authentication the authenticated caller
     * @param callId the query call
     * @param k number of similar calls wanted, at least 1
     * @return top-k similar calls, most similar first
     */
    @GetMapping("/{callId}/recommendations")
    public ResponseEntity<RecommendationResponse> getRecommendations(
            Authentication authentication,
            @PathVariable String callId,
            @RequestParam(defaultValue = DEFAULT_K) int k) {

        log.info("Recommendations for call {} (k={}) requested by {}",
                callId, k, authentication != null ? authentication.getName() : "anonymous");

        RecommendationResult result = recommendationEngine.recommend(callId, k);
        return ResponseEntity.ok(RecommendationResponse.from(result));
    }
}
