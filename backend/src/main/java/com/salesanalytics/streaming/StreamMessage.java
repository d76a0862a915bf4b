package com.salesanalytics.streaming;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.salesanalytics.exception.AnalyticsException;
import com.salesanalytics.exception.ErrorCode;
import com.salesanalytics.sentiment.SentimentSample;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Server-to-client message of the sentiment stream protocol.
 *
 * Every message has a {@code type}; the remaining fields are present only for the
 * types that use them:
 * <pre>
 * {"type":"connection_established","call_id":"c1","session_id":"...","message":"..."}
 * {"type":"sentiment_update","data":{...sample...}}
 * {"type":"pong"}
 * {"type":"history","data":[...samples...]}
 * {"type":"error","code":"UNKNOWN_COMMAND","message":"..."}
 * {"type":"stream_stopped","reason":"stopped","message":"..."}
 * </pre>
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StreamMessage {

    Type type;
    String callId;
    String sessionId;
    String message;
    Object data;
    ErrorCode code;
    StopReason reason;

    public static StreamMessage connectionEstablished(String callId, String sessionId) {
        return StreamMessage.builder()
                .type(Type.CONNECTION_ESTABLISHED)
                .callId(callId)
                .sessionId(sessionId)
                .message("Connected to live sentiment stream for call " + callId)
                .build();
    }

    public static StreamMessage sentimentUpdate(SentimentSample sample) {
        return StreamMessage.builder()
                .type(Type.SENTIMENT_UPDATE)
                .data(sample)
                .build();
    }

    public static StreamMessage pong() {
        return StreamMessage.builder().type(Type.PONG).build();
    }

    public static StreamMessage history(List<SentimentSample> samples) {
        return StreamMessage.builder()
                .type(Type.HISTORY)
                .data(List.copyOf(samples))
                .build();
    }

    public static StreamMessage error(ErrorCode code, String message) {
        return StreamMessage.builder()
                .type(Type.ERROR)
                .code(code)
                .message(message)
                .build();
    }

    public static StreamMessage error(AnalyticsException exception) {
        return error(exception.getErrorCode(), exception.getMessage());
    }

    public static StreamMessage streamStopped(StopReason reason) {
        return StreamMessage.builder()
                .type(Type.STREAM_STOPPED)
                .reason(reason)
                .message(reason.getDescription())
                .build();
    }

    public enum Type {
        CONNECTION_ESTABLISHED,
        SENTIMENT_UPDATE,
        PONG,
        HISTORY,
        ERROR,
        STREAM_STOPPED;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }
    }
}
