package com.salesanalytics.exception;

/**
 * Exception thrown when the AI sentiment scorer cannot produce a score.
 *
 * This exception is used when a sentiment scoring call fails: the scorer is
 * disabled or unreachable, the model call errors out, or the model returns a
 * response that is not the expected JSON. The sentiment sampler treats it as an
 * unavailable scorer and may fall back to synthetic samples.
 *
 * Usage examples:
 * - Scoring disabled by configuration (no API key in development)
 * - Anthropic API rate limit exceeded or network timeout
 * - Call has no transcript to score
 * - Model returned non-JSON or out-of-range values
 *
 * @see com.salesanalytics.sentiment.ClaudeSentimentScorer
 * @see com.salesanalytics.sentiment.FallbackSentimentSampler
 */
public class ProcessingException extends AnalyticsException {

    private final String processingStage;

    /**
     * Constructs a new ProcessingException with stage, error code, message, and cause.
     *
     * @param processingStage the stage where processing failed (e.g., "scoring", "parsing")
     * @param errorCode the error code for categorization
     * @param message the detail message
     * @param cause the cause of the exception
     */
    public ProcessingException(String processingStage, ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.processingStage = processingStage;
    }

    /**
     * Gets the processing stage where the error occurred.
     *
     * @return the processing stage
     */
    public String getProcessingStage() {
        return processingStage;
    }

    /**
     * Constructs a new ProcessingException when the scorer is switched off or has no model.
     *
     * @param callId the call being scored
     * @return a ProcessingException with a formatted message
     */
    public static ProcessingException scorerUnavailable(String callId) {
        return new ProcessingException(
                "scoring",
                ErrorCode.SCORER_UNAVAILABLE,
                String.format("AI sentiment scorer is unavailable for call '%s'.", callId),
                null
        );
    }

    /**
     * Constructs a new ProcessingException when a call has no transcript to score.
     *
     * @param callId the call being scored
     * @return a ProcessingException with a formatted message
     */
    public static ProcessingException missingTranscript(String callId) {
        return new ProcessingException(
                "scoring",
                ErrorCode.SCORER_UNAVAILABLE,
                String.format("Call '%s' has no transcript lines to score.", callId),
                null
        );
    }

    /**
     * Constructs a new ProcessingException for model call failures.
     *
     * @param callId the call being scored
     * @param cause the cause of the failure
     * @return a ProcessingException with a formatted message
     */
    public static ProcessingException analysisFailed(String callId, Throwable cause) {
        return new ProcessingException(
                "scoring",
                ErrorCode.ANALYSIS_FAILED,
                String.format("Sentiment analysis failed for call '%s'. The AI service may be unavailable or rate limited.", callId),
                cause
        );
    }

    /**
     * Constructs a new ProcessingException for a model response that cannot be used.
     *
     * @param callId the call being scored
     * @param reason what was wrong with the response
     * @param cause the parsing cause, may be null
     * @return a ProcessingException with a formatted message
     */
    public static ProcessingException invalidResponse(String callId, String reason, Throwable cause) {
        return new ProcessingException(
                "parsing",
                ErrorCode.INVALID_RESPONSE,
                String.format("AI scorer returned an unusable response for call '%s': %s", callId, reason),
                cause
        );
    }
}
