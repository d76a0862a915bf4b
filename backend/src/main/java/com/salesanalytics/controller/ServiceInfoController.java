package com.salesanalytics.controller;

import com.salesanalytics.streaming.StreamController;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Public service banner and liveness check for load balancers.
 */
@RestController
@RequiredArgsConstructor
public class ServiceInfoController {

    private final StreamController streamController;

    @Value("${spring.application.name:sales-analytics}")
    private String serviceName;

    @Value("${app.version:1.0.0}")
    private String version;

    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of(
                "message", "Sales Call Analytics API",
                "version", version
        );
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        return Map.of(
                "status", "healthy",
                "service", serviceName,
                "active_streams", streamController.activeStreams().size()
        );
    }
}
