package com.security.anomaly.controller;

import com.security.anomaly.model.AccessEvent;
import com.security.anomaly.model.AnomalySeverity;
import com.security.anomaly.service.AnomalyManager;
import com.security.anomaly.testutil.TestDataFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(EventController.class)
class EventControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private AnomalyManager anomalyManager;

    @Test
    void processEvent_anomalous_returnsAnomalies() throws Exception {
        when(anomalyManager.processEvent(any(AccessEvent.class)))
                .thenReturn(List.of(TestDataFactory.anomaly("a-1", AnomalySeverity.HIGH)));

        AccessEvent event = TestDataFactory.accessEvent("alice", "10.0.0.1", "2026-03-14T02:15:00Z");

        mockMvc.perform(post("/api/v1/security/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(event)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray())
                .andExpect(jsonPath("$[0].anomalyId").value("a-1"))
                .andExpect(jsonPath("$[0].severity").value("high"))
                .andExpect(jsonPath("$[0].anomalyType").value("access_time"))
                .andExpect(jsonPath("$[0].status").value("new"))
                .andExpect(jsonPath("$[0].responseActions[0]").value("log_only"));
    }

    @Test
    void processEvent_normal_returnsEmptyList() throws Exception {
        when(anomalyManager.processEvent(any(AccessEvent.class))).thenReturn(List.of());

        mockMvc.perform(post("/api/v1/security/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"timestamp\":\"2026-03-14T10:00:00Z\",\"userId\":\"alice\",\"ipAddress\":\"10.0.0.1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());
    }

    @Test
    void processEvent_missingTimestamp_returnsEmptyList() throws Exception {
        when(anomalyManager.processEvent(any(AccessEvent.class))).thenReturn(List.of());

        mockMvc.perform(post("/api/v1/security/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"alice\",\"ipAddress\":\"10.0.0.1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());

        verify(anomalyManager).processEvent(any(AccessEvent.class));
    }
}
