package com.ai.leasing.jobs;

import com.ai.leasing.service.MetricsAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Nightly rollup of the current local day.
 */
@Component
public class MetricsRollupJob {

    private static final Logger log = LoggerFactory.getLogger(MetricsRollupJob.class);

    private final MetricsAggregator metricsAggregator;
    private final Clock clock;

    public MetricsRollupJob(MetricsAggregator metricsAggregator, Clock clock) {
        this.metricsAggregator = metricsAggregator;
        this.clock = clock;
    }

    @Scheduled(cron = "${leasing.metrics.rollup-cron:0 55 23 * * *}", zone = "${leasing.timezone:Asia/Jerusalem}")
    public void run() {
        LocalDate today = LocalDate.now(clock);
        try {
            metricsAggregator.rollup(today);
        } catch (RuntimeException e) {
            log.error("Metrics rollup for {} failed", today, e);
        }
    }
}
