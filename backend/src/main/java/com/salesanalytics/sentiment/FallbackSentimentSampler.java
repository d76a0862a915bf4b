package com.salesanalytics.sentiment;

import com.salesanalytics.exception.ProcessingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Samples the AI scorer and degrades to the synthetic generator when it is unavailable.
 *
 * With {@code app.streaming.sampler.fallback-enabled=false} scorer failures are
 * propagated instead, and the stream controller counts them toward its
 * consecutive-failure limit.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FallbackSentimentSampler implements SentimentSampler {

    private final SentimentScorer sentimentScorer;
    private final SyntheticSentimentGenerator syntheticGenerator;
    private final Clock clock;

    @Value("${app.streaming.sampler.fallback-enabled:true}")
    private boolean fallbackEnabled = true;

    @Override
    public SentimentSample sample(String callId) {
        Instant now = clock.instant();
        try {
            SentimentScore score = sentimentScorer.score(callId);
            return SentimentSample.create(
                    callId,
                    now,
                    score.sentimentScore(),
                    score.confidence(),
                    score.emotion(),
                    null,
                    false
            );
        } catch (ProcessingException e) {
            if (!fallbackEnabled) {
                throw e;
            }
            log.debug("Scorer unavailable for call {} ({}), using synthetic sample", callId, e.getErrorCode());
            return syntheticGenerator.generate(callId, now);
        }
    }

    @Override
    public void release(String callId) {
        sentimentScorer.release(callId);
    }
}
