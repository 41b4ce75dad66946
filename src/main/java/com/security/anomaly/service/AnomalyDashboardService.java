package com.security.anomaly.service;

import com.security.anomaly.model.AnomalyEvent;
import com.security.anomaly.model.AnomalyQuery;
import com.security.anomaly.model.AnomalySeverity;
import com.security.anomaly.model.AnomalyStatus;
import com.security.anomaly.model.DashboardSummary;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Aggregates recent anomalies for the security dashboard.
 */
@Service
public class AnomalyDashboardService {

    static final int SAMPLE_SIZE = 1000;
    static final int TOP_N = 10;
    static final int CHART_DAYS = 30;

    private final AnomalyManager anomalyManager;
    private final Clock clock;

    public AnomalyDashboardService(AnomalyManager anomalyManager, Clock clock) {
        this.anomalyManager = anomalyManager;
        this.clock = clock;
    }

    public DashboardSummary summarize() {
        List<AnomalyEvent> anomalies = anomalyManager.getRecentAnomalies(
                AnomalyQuery.builder().limit(SAMPLE_SIZE).build());

        Map<String, Integer> bySeverity = new LinkedHashMap<>();
        for (AnomalySeverity severity : AnomalySeverity.values()) {
            bySeverity.put(severity.getValue(), 0);
        }
        Map<String, Integer> byStatus = new LinkedHashMap<>();
        for (AnomalyStatus status : AnomalyStatus.values()) {
            byStatus.put(status.getValue(), 0);
        }
        Map<String, Integer> byType = new LinkedHashMap<>();

        for (AnomalyEvent anomaly : anomalies) {
            bySeverity.merge(anomaly.getSeverity().getValue(), 1, Integer::sum);
            byStatus.merge(anomaly.getStatus().getValue(), 1, Integer::sum);
            byType.merge(anomaly.getAnomalyType().getValue(), 1, Integer::sum);
        }

        return DashboardSummary.builder()
                .total(anomalies.size())
                .bySeverity(bySeverity)
                .byStatus(byStatus)
                .byType(byType)
                .topUsers(top(anomalies, AnomalyEvent::getUserId))
                .topIps(top(anomalies, AnomalyEvent::getSourceIp))
                .chartData(dailyChart(anomalies))
                .build();
    }

    private static List<DashboardSummary.CountEntry> top(List<AnomalyEvent> anomalies,
                                                         Function<AnomalyEvent, String> key) {
        Map<String, Integer> counts = new HashMap<>();
        for (AnomalyEvent anomaly : anomalies) {
            String value = key.apply(anomaly);
            if (value != null && !value.isEmpty()) {
                counts.merge(value, 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(TOP_N)
                .map(e -> new DashboardSummary.CountEntry(e.getKey(), e.getValue()))
                .toList();
    }

    // One entry per UTC day, oldest first, ending today
    private List<DashboardSummary.CountEntry> dailyChart(List<AnomalyEvent> anomalies) {
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        LocalDate first = today.minusDays(CHART_DAYS - 1);

        Map<LocalDate, Integer> perDay = new HashMap<>();
        for (AnomalyEvent anomaly : anomalies) {
            if (anomaly.getTimestamp() == null) continue;
            LocalDate day = LocalDate.ofInstant(anomaly.getTimestamp(), ZoneOffset.UTC);
            if (!day.isBefore(first) && !day.isAfter(today)) {
                perDay.merge(day, 1, Integer::sum);
            }
        }

        List<DashboardSummary.CountEntry> chart = new ArrayList<>(CHART_DAYS);
        for (LocalDate day = first; !day.isAfter(today); day = day.plusDays(1)) {
            chart.add(new DashboardSummary.CountEntry(day.toString(), perDay.getOrDefault(day, 0)));
        }
        return chart;
    }
}
