package com.salesanalytics.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Entity representing a recorded sales call and its AI-derived metrics.
 *
 * Rows are written by the ingestion service; this service only reads them
 * through the call ledger.
 *
 * Database constraints:
 * - call_id must be unique
 * - embeddings is a JSON array of numbers, null until the call has been analyzed
 *
 * Indexes:
 * - idx_calls_call_id: lookups by external call identifier
 * - idx_calls_agent_time: agent timelines
 */
@Entity
@Table(name = "calls", indexes = {
    @Index(name = "idx_calls_call_id", columnList = "call_id", unique = true),
    @Index(name = "idx_calls_agent_time", columnList = "agent_id, start_time")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Call {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * External call identifier (the CallId used by every API).
     */
    @Column(name = "call_id", nullable = false, unique = true, length = 100)
    private String callId;

    @Column(name = "agent_id", nullable = false, length = 100)
    private String agentId;

    @Column(name = "customer_id", nullable = false, length = 100)
    private String customerId;

    @Column(name = "language", nullable = false, length = 10)
    private String language = "en";

    @Column(name = "start_time", nullable = false)
    private LocalDateTime startTime;

    @Column(name = "duration_seconds", nullable = false)
    private Integer durationSeconds;

    /**
     * Full transcript, one utterance per line in the form {@code Speaker: text}.
     */
    @Column(name = "transcript", nullable = false, columnDefinition = "TEXT")
    private String transcript;

    @Column(name = "agent_talk_ratio")
    private Double agentTalkRatio;

    /**
     * Whole-call customer sentiment in [-1, 1].
     */
    @Column(name = "customer_sentiment_score")
    private Double customerSentimentScore;

    /**
     * Sentence embedding of the transcript.
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "embeddings", columnDefinition = "json")
    private List<Double> embeddings;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
