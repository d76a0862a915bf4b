package com.salesanalytics.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.salesanalytics.streaming.ActiveStream;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Status of one live call stream, for operations dashboards.
 *
 * Example JSON response:
 * <pre>
 * {
 *   "call_id": "call-001",
 *   "state": "ACTIVE",
 *   "subscribers": 2,
 *   "history_size": 37,
 *   "last_sequence": 37
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StreamStatusResponse {

    private String callId;

    private String state;

    private int subscribers;

    private int historySize;

    private long lastSequence;

    public static StreamStatusResponse from(ActiveStream stream) {
        return StreamStatusResponse.builder()
                .callId(stream.callId())
                .state(stream.state().name())
                .subscribers(stream.subscribers())
                .historySize(stream.historySize())
                .lastSequence(stream.lastSequence())
                .build();
    }
}
