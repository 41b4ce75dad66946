package com.security.anomaly.controller;

import com.security.anomaly.model.TrainingResult;
import com.security.anomaly.service.AnomalyManager;
import com.security.anomaly.testutil.TestDataFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(DetectorController.class)
class DetectorControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private AnomalyManager anomalyManager;

    @Test
    void getSettings_success() throws Exception {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("detectors", Map.of("access_time_detector", Map.of("enabled", true, "minDataPoints", 20)));
        settings.put("general", Map.of("storageRetentionDays", 30));
        when(anomalyManager.getSettings()).thenReturn(settings);

        mockMvc.perform(get("/api/v1/security/settings"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.detectors.access_time_detector.enabled").value(true))
                .andExpect(jsonPath("$.general.storageRetentionDays").value(30));
    }

    @Test
    void updateSettings_success() throws Exception {
        when(anomalyManager.updateSettings(anyMap()))
                .thenReturn(Map.of("general", Map.of("storageRetentionDays", 14)));

        mockMvc.perform(put("/api/v1/security/settings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"general\":{\"storageRetentionDays\":14}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.general.storageRetentionDays").value(14));
    }

    @Test
    void updateSettings_invalidValue_returns400() throws Exception {
        when(anomalyManager.updateSettings(anyMap()))
                .thenThrow(new IllegalArgumentException("Invalid value for storageRetentionDays: abc (expected an integer)"));

        mockMvc.perform(put("/api/v1/security/settings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"general\":{\"storageRetentionDays\":\"abc\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(
                        "Invalid value for storageRetentionDays: abc (expected an integer)"));
    }

    @Test
    void train_selectedDetectors_reportsPerDetectorResults() throws Exception {
        Map<String, TrainingResult> results = new LinkedHashMap<>();
        results.put("access_time_detector", TrainingResult.builder().success(true).baselineEstablished(true).build());
        results.put("ml_detector", TrainingResult.failed("Detector not registered"));
        when(anomalyManager.trainDetectors(anyList(), eq(List.of("access_time_detector", "ml_detector"))))
                .thenReturn(results);

        Map<String, Object> body = Map.of(
                "detectors", List.of("access_time_detector", "ml_detector"),
                "events", TestDataFactory.eventsAtHours("alice", 2, 9, 10));

        mockMvc.perform(post("/api/v1/security/train")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(body)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.trainingEvents").value(4))
                .andExpect(jsonPath("$.results.access_time_detector.success").value(true))
                .andExpect(jsonPath("$.results.ml_detector.error").value("Detector not registered"));
    }

    @Test
    void train_allFail_reportsFailure() throws Exception {
        when(anomalyManager.trainDetectors(anyList(), isNull()))
                .thenReturn(Map.of("request_frequency_detector", TrainingResult.builder().success(false).build()));

        mockMvc.perform(post("/api/v1/security/train")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "events", TestDataFactory.eventsAtHours("alice", 1, 9)))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void train_noEvents_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/security/train")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"detectors\":[\"access_time_detector\"],\"events\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("events must not be empty"));

        verify(anomalyManager, never()).trainDetectors(any(), any());
    }
}
