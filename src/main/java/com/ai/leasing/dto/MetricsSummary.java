package com.ai.leasing.dto;

import com.ai.leasing.entity.DailyMetric;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

@Getter
@AllArgsConstructor
public class MetricsSummary {

    private final LocalDate from;
    private final LocalDate to;
    private final List<DailyMetricResponse> dailyMetrics;
    private final Totals totals;
    private final Instant timestamp;

    @Getter
    @AllArgsConstructor
    public static class Totals {
        private final int totalInquiries;
        private final int qualifiedLeads;
        private final int toursScheduled;
        private final int toursCompleted;
    }

    public static MetricsSummary of(LocalDate from, LocalDate to, List<DailyMetric> rows, Instant now) {
        Totals totals = new Totals(
                rows.stream().mapToInt(DailyMetric::getTotalInquiries).sum(),
                rows.stream().mapToInt(DailyMetric::getQualifiedLeads).sum(),
                rows.stream().mapToInt(DailyMetric::getToursScheduled).sum(),
                rows.stream().mapToInt(DailyMetric::getToursCompleted).sum());
        return new MetricsSummary(from, to,
                rows.stream().map(DailyMetricResponse::of).collect(Collectors.toList()), totals, now);
    }
}
