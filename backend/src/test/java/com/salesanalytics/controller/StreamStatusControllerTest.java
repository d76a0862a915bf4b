package com.salesanalytics.controller;

import com.salesanalytics.exception.GlobalExceptionHandler;
import com.salesanalytics.sentiment.SentimentSample;
import com.salesanalytics.streaming.ActiveStream;
import com.salesanalytics.streaming.StreamController;
import com.salesanalytics.streaming.StreamState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("StreamStatusController and ServiceInfoController Tests")
class StreamStatusControllerTest {

    @Mock
    private StreamController streamController;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ServiceInfoController serviceInfoController = new ServiceInfoController(streamController);
        ReflectionTestUtils.setField(serviceInfoController, "serviceName", "sales-analytics");
        ReflectionTestUtils.setField(serviceInfoController, "version", "1.0.0");

        mockMvc = MockMvcBuilders.standaloneSetup(new StreamStatusController(streamController), serviceInfoController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("active streams should be listed")
    void testGetActiveStreams() throws Exception {
        // Arrange
        when(streamController.activeStreams())
                .thenReturn(List.of(new ActiveStream("call-1", StreamState.ACTIVE, 2, 10, 10L)));

        // Act & Assert
        mockMvc.perform(get("/api/v1/streams"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].call_id").value("call-1"))
                .andExpect(jsonPath("$[0].state").value("ACTIVE"))
                .andExpect(jsonPath("$[0].subscribers").value(2))
                .andExpect(jsonPath("$[0].last_sequence").value(10));
    }

    @Test
    @DisplayName("history of a live stream should be returned")
    void testGetHistory() throws Exception {
        // Arrange
        SentimentSample sample = SentimentSample.create("call-1", Instant.parse("2024-01-15T10:30:00Z"),
                0.3, 0.8, null, null, false).withSequence(1);
        when(streamController.history("call-1")).thenReturn(Optional.of(List.of(sample)));

        // Act & Assert
        mockMvc.perform(get("/api/v1/streams/call-1/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.samples[0].sequence").value(1))
                .andExpect(jsonPath("$.samples[0].emotion").value("positive"));
    }

    @Test
    @DisplayName("history of a call without a stream should map to 404")
    void testGetHistory_NoStream() throws Exception {
        // Arrange
        when(streamController.history("call-9")).thenReturn(Optional.empty());

        // Act & Assert
        mockMvc.perform(get("/api/v1/streams/call-9/history"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("health should report the number of active streams")
    void testHealth() throws Exception {
        // Arrange
        when(streamController.activeStreams())
                .thenReturn(List.of(new ActiveStream("call-1", StreamState.ACTIVE, 1, 0, 0L)));

        // Act & Assert
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.active_streams").value(1));
    }
}
