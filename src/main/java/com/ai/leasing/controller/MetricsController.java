package com.ai.leasing.controller;

import com.ai.leasing.dto.DailyMetricResponse;
import com.ai.leasing.dto.MetricsSummary;
import com.ai.leasing.exception.NotFoundException;
import com.ai.leasing.service.MetricsAggregator;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/metrics/daily")
public class MetricsController {

    private final MetricsAggregator metricsAggregator;

    public MetricsController(MetricsAggregator metricsAggregator) {
        this.metricsAggregator = metricsAggregator;
    }

    /** Daily rows of the last {@code days} days, today included, plus their totals. */
    @GetMapping
    public ResponseEntity<MetricsSummary> recent(@RequestParam(defaultValue = "7") int days) {
        return ResponseEntity.ok(metricsAggregator.recent(days));
    }

    @GetMapping("/{date}")
    public ResponseEntity<DailyMetricResponse> get(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return metricsAggregator.find(date)
                .map(DailyMetricResponse::of)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new NotFoundException("No metrics for " + date));
    }

    @PostMapping("/{date}/rollup")
    public ResponseEntity<DailyMetricResponse> rollup(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(DailyMetricResponse.of(metricsAggregator.rollup(date)));
    }
}
