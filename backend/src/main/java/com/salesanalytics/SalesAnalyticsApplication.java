package com.salesanalytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main entry point for the Sales Call Analytics backend.
 *
 * This Spring Boot application provides:
 * - Live customer sentiment streams per call over WebSocket
 * - Similar-call recommendations by embedding cosine similarity
 * - JWT authentication shared with the credential service
 * - Optional Claude scoring via Spring AI, with a synthetic fallback
 * - PostgreSQL call ledger with JSON embeddings
 */
@SpringBootApplication
public class SalesAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(SalesAnalyticsApplication.class, args);
    }
}
