package com.security.anomaly.controller;

import com.security.anomaly.model.*;
import com.security.anomaly.service.AnomalyDashboardService;
import com.security.anomaly.service.AnomalyManager;
import com.security.anomaly.testutil.TestDataFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AnomalyController.class)
class AnomalyControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private AnomalyManager anomalyManager;

    @MockBean
    private AnomalyDashboardService dashboardService;

    @Test
    void listAnomalies_withFilters_buildsQuery() throws Exception {
        when(anomalyManager.getRecentAnomalies(any()))
                .thenReturn(List.of(TestDataFactory.anomaly("a-1", AnomalySeverity.HIGH)));

        mockMvc.perform(get("/api/v1/security/anomalies")
                        .param("limit", "20")
                        .param("status", "new")
                        .param("severity", "high, critical")
                        .param("type", "access_time")
                        .param("fromDate", "2026-03-01T00:00:00Z")
                        .param("toDate", "2026-03-14T23:59:59")
                        .param("userId", "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].anomalyId").value("a-1"));

        ArgumentCaptor<AnomalyQuery> captor = ArgumentCaptor.forClass(AnomalyQuery.class);
        verify(anomalyManager).getRecentAnomalies(captor.capture());
        AnomalyQuery query = captor.getValue();
        assertThat(query.getLimit()).isEqualTo(20);
        assertThat(query.getStatus()).isEqualTo(AnomalyStatus.NEW);
        assertThat(query.getSeverities()).containsExactlyInAnyOrder(AnomalySeverity.HIGH, AnomalySeverity.CRITICAL);
        assertThat(query.getTypes()).containsExactly(AnomalyType.ACCESS_TIME);
        assertThat(query.getFrom()).isEqualTo(Instant.parse("2026-03-01T00:00:00Z"));
        assertThat(query.getTo()).isEqualTo(Instant.parse("2026-03-14T23:59:59Z"));
        assertThat(query.getUserId()).isEqualTo("alice");
    }

    @Test
    void listAnomalies_defaults_useLimitOfHundred() throws Exception {
        when(anomalyManager.getRecentAnomalies(any())).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/security/anomalies"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());

        verify(anomalyManager).getRecentAnomalies(argThat(q -> q.getLimit() == 100 && q.getSeverities() == null));
    }

    @Test
    void listAnomalies_nonPositiveLimit_returns400() throws Exception {
        mockMvc.perform(get("/api/v1/security/anomalies?limit=0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());

        verifyNoInteractions(anomalyManager);
    }

    @Test
    void listAnomalies_invalidSeverity_returns400() throws Exception {
        mockMvc.perform(get("/api/v1/security/anomalies?severity=urgent"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid severity: urgent"));
    }

    @Test
    void listAnomalies_invalidDate_returns400() throws Exception {
        mockMvc.perform(get("/api/v1/security/anomalies?fromDate=last-week"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid fromDate: last-week"));
    }

    @Test
    void getAnomaly_found() throws Exception {
        when(anomalyManager.getAnomaly("a-1")).thenReturn(TestDataFactory.anomaly("a-1", AnomalySeverity.LOW));

        mockMvc.perform(get("/api/v1/security/anomalies/a-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.anomalyId").value("a-1"))
                .andExpect(jsonPath("$.details.detectionMethod").value("test"));
    }

    @Test
    void getAnomaly_notFound() throws Exception {
        when(anomalyManager.getAnomaly("missing")).thenReturn(null);

        mockMvc.perform(get("/api/v1/security/anomalies/missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void updateStatus_success() throws Exception {
        AnomalyEvent updated = TestDataFactory.anomaly("a-1", AnomalySeverity.HIGH).toBuilder()
                .status(AnomalyStatus.RESOLVED)
                .reviewComments("password reset")
                .reviewerId("analyst-7")
                .build();
        when(anomalyManager.updateAnomalyStatus("a-1", "resolved", "password reset", "analyst-7"))
                .thenReturn(updated);

        mockMvc.perform(put("/api/v1/security/anomalies/a-1/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "status", "resolved",
                                "comments", "password reset",
                                "reviewerId", "analyst-7"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("resolved"))
                .andExpect(jsonPath("$.reviewerId").value("analyst-7"));
    }

    @Test
    void updateStatus_missingStatus_returns400() throws Exception {
        mockMvc.perform(put("/api/v1/security/anomalies/a-1/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"comments\":\"looks fine\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("status is required"));
    }

    @Test
    void updateStatus_invalidStatus_returns400() throws Exception {
        when(anomalyManager.updateAnomalyStatus(eq("a-1"), eq("closed"), any(), any()))
                .thenThrow(new IllegalArgumentException("Invalid status: closed"));

        mockMvc.perform(put("/api/v1/security/anomalies/a-1/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"closed\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid status: closed"));
    }

    @Test
    void updateStatus_unknownAnomaly_returns404() throws Exception {
        when(anomalyManager.updateAnomalyStatus(eq("missing"), eq("resolved"), any(), any())).thenReturn(null);

        mockMvc.perform(put("/api/v1/security/anomalies/missing/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"resolved\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getDashboard_returnsSummary() throws Exception {
        when(dashboardService.summarize()).thenReturn(DashboardSummary.builder()
                .total(3)
                .bySeverity(Map.of("high", 3))
                .byStatus(Map.of("new", 3))
                .byType(Map.of("access_time", 3))
                .topUsers(List.of(new DashboardSummary.CountEntry("alice", 3)))
                .topIps(List.of())
                .chartData(List.of(new DashboardSummary.CountEntry("2026-03-14", 3)))
                .build());

        mockMvc.perform(get("/api/v1/security/anomalies/dashboard"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(3))
                .andExpect(jsonPath("$.topUsers[0].key").value("alice"))
                .andExpect(jsonPath("$.chartData[0].count").value(3));
    }

    @Test
    void cleanup_returnsRemovedCount() throws Exception {
        when(anomalyManager.cleanupOldAnomalies()).thenReturn(7);

        mockMvc.perform(post("/api/v1/security/anomalies/cleanup"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.removedCount").value(7));
    }
}
