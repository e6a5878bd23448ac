package com.ai.leasing.jobs;

import com.ai.leasing.dto.DispatchSummary;
import com.ai.leasing.service.FollowupScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polls for due followups. A cycle that is still running when the next one fires makes
 * the next one a no-op.
 */
@Component
public class FollowupDispatchJob {

    private static final Logger log = LoggerFactory.getLogger(FollowupDispatchJob.class);

    private final FollowupScheduler followupScheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public FollowupDispatchJob(FollowupScheduler followupScheduler) {
        this.followupScheduler = followupScheduler;
    }

    @Scheduled(fixedDelayString = "${leasing.followups.poll-interval:PT60S}",
            initialDelayString = "${leasing.followups.initial-delay:PT10S}")
    public void run() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Previous dispatch cycle still running, skipping");
            return;
        }
        try {
            DispatchSummary summary = followupScheduler.dispatchDue();
            if (summary.getPicked() > 0) {
                log.info("Followup dispatch: {}", summary);
            }
        } catch (RuntimeException e) {
            log.error("Followup dispatch cycle failed", e);
        } finally {
            running.set(false);
        }
    }
}
