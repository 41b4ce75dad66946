package com.security.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DashboardSummary {
    private int total;
    private Map<String, Integer> bySeverity;
    private Map<String, Integer> byStatus;
    private Map<String, Integer> byType;
    private List<CountEntry> topUsers;
    private List<CountEntry> topIps;
    // Last 30 days, oldest first
    private List<CountEntry> chartData;

    public record CountEntry(String key, int count) {}
}
