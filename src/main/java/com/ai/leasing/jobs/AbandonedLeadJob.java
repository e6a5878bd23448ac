package com.ai.leasing.jobs;

import com.ai.leasing.component.LeadLockRegistry;
import com.ai.leasing.service.FollowupScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Queues a nudge for leads that went quiet mid-funnel. Runs hourly.
 */
@Component
public class AbandonedLeadJob {

    private static final Logger log = LoggerFactory.getLogger(AbandonedLeadJob.class);

    private final FollowupScheduler followupScheduler;
    private final LeadLockRegistry locks;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public AbandonedLeadJob(FollowupScheduler followupScheduler, LeadLockRegistry locks) {
        this.followupScheduler = followupScheduler;
        this.locks = locks;
    }

    @Scheduled(cron = "${leasing.followups.abandoned-cron:0 0 * * * *}", zone = "${leasing.timezone:Asia/Jerusalem}")
    public void run() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            int queued = enqueueAbandonedLeadNudges();
            log.info("Abandoned-lead check queued {} nudge(s)", queued);
        } catch (RuntimeException e) {
            log.error("Abandoned-lead check failed", e);
        } finally {
            running.set(false);
        }
    }

    int enqueueAbandonedLeadNudges() {
        List<String> candidates = followupScheduler.findNudgeCandidates();
        int queued = 0;
        for (String phone : candidates) {
            try {
                if (locks.withLead(phone, () -> followupScheduler.nudgeIfInactive(phone))) {
                    queued++;
                }
            } catch (RuntimeException e) {
                log.error("Could not queue nudge for {}", phone, e);
            }
        }
        return queued;
    }
}
