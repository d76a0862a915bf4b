package com.salesanalytics.controller;

import com.salesanalytics.dto.response.AgentAnalyticsResponse;
import com.salesanalytics.ledger.CallLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST Controller for aggregate call analytics.
 *
 * Endpoints:
 * - GET /api/v1/analytics/agents - Agent leaderboard (admin, manager)
 *
 * Error Responses (RFC 7807 via GlobalExceptionHandler):
 * - 401 Unauthorized: missing or invalid token
 * - 403 Forbidden: caller is neither admin nor manager
 */
@RestController
@RequestMapping("/api/v1/analytics")
@RequiredArgsConstructor
@Slf4j
public class AnalyticsController {

    private final CallLedger callLedger;

    /**
     * Get the agent leaderboard.
     *
     * Agents are ordered by average customer sentiment, highest first; agents whose
     * calls carry no sentiment score are listed last.
     *
     * @param authentication the authenticated caller
     * @return one entry per agent with at least one recorded call
     */
    @GetMapping("/agents")
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
    public ResponseEntity<List<AgentAnalyticsResponse>> getAgentLeaderboard(Authentication authentication) {
        List<AgentAnalyticsResponse> leaderboard = callLedger.getAgentLeaderboard().stream()
                .map(AgentAnalyticsResponse::from)
                .toList();

        log.info("Agent leaderboard ({} agents) requested by {}",
                leaderboard.size(), authentication != null ? authentication.getName() : "anonymous");
        return ResponseEntity.ok(leaderboard);
    }
}
