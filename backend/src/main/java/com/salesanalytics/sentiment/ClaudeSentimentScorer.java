package com.salesanalytics.sentiment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesanalytics.exception.ProcessingException;
import com.salesanalytics.ledger.CallLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Service for scoring live call sentiment using Claude via Spring AI.
 *
 * Each invocation scores a rolling window of the customer's utterances from the
 * call transcript; the window advances by one utterance per call per invocation
 * and wraps at the end of the transcript, so consecutive ticks see the
 * conversation move forward.
 *
 * Flow:
 * 1. Load the transcript from the call ledger
 * 2. Select the customer lines in the current window
 * 3. Ask Claude for {"sentiment_score", "confidence", "emotion"} as JSON
 * 4. Strip markdown fences, parse, validate and clamp the values
 *
 * Scoring is off unless {@code app.ai.scorer.enabled=true} and a chat client is
 * configured; while off every call fails fast with {@code SCORER_UNAVAILABLE}.
 *
 * @see com.salesanalytics.config.SpringAIConfig
 * @see com.salesanalytics.sentiment.FallbackSentimentSampler
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ClaudeSentimentScorer implements SentimentScorer {

    private final ObjectProvider<ChatClient> claudeClient;
    private final ObjectMapper objectMapper;
    private final CallLedger callLedger;

    @Value("${app.ai.scorer.enabled:false}")
    private boolean enabled;

    @Value("${app.ai.scorer.window-lines:4}")
    private int windowLines;

    private final Map<String, AtomicInteger> cursors = new ConcurrentHashMap<>();

    /**
     * System prompt for sentiment scoring.
     */
    private static final String SYSTEM_PROMPT = """
            You score the sentiment of a customer on a live sales call.
            You receive the most recent customer utterances, oldest first.

            Return:
            1. SENTIMENT_SCORE: a number from -1.0 (very negative) to 1.0 (very positive)
            2. CONFIDENCE: a number from 0.0 to 1.0
            3. EMOTION: one of very_positive, positive, neutral, negative, very_negative

            Rules:
            - Weight the latest utterance most heavily
            - Politeness alone is neutral, not positive
            - Return ONLY valid JSON, no additional text or explanations

            Output format (JSON):
            {
              "sentiment_score": <number>,
              "confidence": <number>,
              "emotion": "<emotion>"
            }
            """;

    @Override
    public SentimentScore score(String callId) {
        ChatClient client = enabled ? claudeClient.getIfAvailable() : null;
        if (client == null) {
            throw ProcessingException.scorerUnavailable(callId);
        }

        List<String> window = nextWindow(callId);
        String utterances = String.join("\n", window);
        log.debug("Scoring {} customer lines for call {}", window.size(), callId);

        String jsonResponse;
        try {
            jsonResponse = client.prompt()
                    .system(SYSTEM_PROMPT)
                    .user(utterances)
                    .call()
                    .content();
        } catch (RuntimeException e) {
            log.error("Sentiment scoring call failed for {}: {}", callId, e.getMessage());
            throw ProcessingException.analysisFailed(callId, e);
        }

        if (jsonResponse == null || jsonResponse.trim().isEmpty()) {
            log.warn("Claude returned empty response for call {}", callId);
            throw ProcessingException.invalidResponse(callId, "empty response", null);
        }

        try {
            return toScore(callId, parseJsonResponse(jsonResponse));
        } catch (JsonProcessingException e) {
            log.error("Failed to parse JSON response from Claude for {}: {}", callId, e.getOriginalMessage());
            throw ProcessingException.invalidResponse(callId, "response is not JSON", e);
        }
    }

    /**
     * Customer lines of the next window for the call; falls back to all speaker lines
     * when the transcript has no customer turns.
     */
    List<String> nextWindow(String callId) {
        String transcript = callLedger.getTranscript(callId)
                .orElseThrow(() -> ProcessingException.missingTranscript(callId));

        List<String> customerLines = new ArrayList<>();
        List<String> allLines = new ArrayList<>();
        for (String line : transcript.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            allLines.add(trimmed);
            int colon = trimmed.indexOf(':');
            if (colon > 0 && trimmed.substring(0, colon).trim().equalsIgnoreCase("customer")) {
                customerLines.add(trimmed.substring(colon + 1).trim());
            }
        }

        List<String> lines = customerLines.isEmpty() ? allLines : customerLines;
        if (lines.isEmpty()) {
            throw ProcessingException.missingTranscript(callId);
        }

        int end = Math.floorMod(cursors.computeIfAbsent(callId, id -> new AtomicInteger()).getAndIncrement(),
                lines.size());
        int start = Math.max(0, end - Math.max(1, windowLines) + 1);
        return new ArrayList<>(lines.subList(start, end + 1));
    }

    /**
     * Forget the window position of a call whose stream has stopped.
     */
    @Override
    public void release(String callId) {
        cursors.remove(callId);
    }

    private Map<String, Object> parseJsonResponse(String jsonResponse) throws JsonProcessingException {
        // Remove markdown code blocks if present
        String cleanedJson = jsonResponse.trim();
        if (cleanedJson.startsWith("```json")) {
            cleanedJson = cleanedJson.substring(7);
        } else if (cleanedJson.startsWith("```")) {
            cleanedJson = cleanedJson.substring(3);
        }
        if (cleanedJson.endsWith("```")) {
            cleanedJson = cleanedJson.substring(0, cleanedJson.length() - 3);
        }

        return objectMapper.readValue(cleanedJson.trim(), new TypeReference<>() {});
    }

    private SentimentScore toScore(String callId, Map<String, Object> data) {
        double score = number(callId, data, "sentiment_score");
        double confidence = number(callId, data, "confidence");

        if (score < -1.0 || score > 1.0) {
            log.warn("Sentiment score {} out of range for call {}, clamping", score, callId);
            score = Math.max(-1.0, Math.min(1.0, score));
        }
        if (confidence < 0.0 || confidence > 1.0) {
            log.warn("Confidence {} out of range for call {}, clamping", confidence, callId);
            confidence = Math.max(0.0, Math.min(1.0, confidence));
        }

        Object rawEmotion = data.get("emotion");
        Emotion emotion = Emotion.fromLabel(rawEmotion instanceof String s ? s : null).orElse(null);
        if (emotion == null) {
            log.debug("Unknown emotion '{}' for call {}, deriving from score", rawEmotion, callId);
        }

        return new SentimentScore(score, confidence, emotion);
    }

    private double number(String callId, Map<String, Object> data, String field) {
        Object value = data.get(field);
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw ProcessingException.invalidResponse(callId, "'" + field + "' is not a number", e);
            }
        }
        throw ProcessingException.invalidResponse(callId, "missing '" + field + "' field", null);
    }
}
