package com.salesanalytics.controller;

import com.salesanalytics.dto.response.StreamHistoryResponse;
import com.salesanalytics.dto.response.StreamStatusResponse;
import com.salesanalytics.exception.CallNotFoundException;
import com.salesanalytics.sentiment.SentimentSample;
import com.salesanalytics.streaming.StreamController;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only REST views of the live sentiment streams.
 *
 * Endpoints:
 * - GET /api/v1/streams - Every live stream with its subscriber count (admin, manager)
 * - GET /api/v1/streams/{callId}/history - Current bounded history of one live stream
 *
 * Reading never starts, restarts or extends a stream.
 */
@RestController
@RequestMapping("/api/v1/streams")
@RequiredArgsConstructor
@Slf4j
public class StreamStatusController {

    private final StreamController streamController;

    /**
     * List live streams, ordered by call id.
     *
     * @return one entry per live stream
     */
    @GetMapping
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
    public ResponseEntity<List<StreamStatusResponse>> getActiveStreams() {
        List<StreamStatusResponse> streams = streamController.activeStreams().stream()
                .map(StreamStatusResponse::from)
                .toList();
        log.debug("Returning {} active streams", streams.size());
        return ResponseEntity.ok(streams);
    }

    /**
     * Get the bounded sample history of a live stream, oldest first.
     *
     * @param callId the call
     * @return the history snapshot
     * @throws CallNotFoundException if the call has no live stream
     */
    @GetMapping("/{callId}/history")
    public ResponseEntity<StreamHistoryResponse> getHistory(@PathVariable String callId) {
        List<SentimentSample> samples = streamController.history(callId)
                .orElseThrow(() -> CallNotFoundException.noLiveStream(callId));

        return ResponseEntity.ok(StreamHistoryResponse.builder()
                .callId(callId)
                .count(samples.size())
                .samples(samples)
                .build());
    }
}
