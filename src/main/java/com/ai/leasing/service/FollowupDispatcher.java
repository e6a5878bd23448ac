package com.ai.leasing.service;

import com.ai.leasing.entity.FollowupTask;
import com.ai.leasing.entity.Lead;
import com.ai.leasing.integration.DeliveryResult;
import com.ai.leasing.integration.MessageSender;
import com.ai.leasing.integration.OutboundMessage;
import com.ai.leasing.repository.FollowupTaskRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Delivers single followup tasks. The task row is locked and its status re-read right
 * before sending, so a task canceled or already handled by another worker, or by this
 * one before a restart, is skipped. The sent status and provider id commit together.
 */
@Service
public class FollowupDispatcher {

    private static final Logger log = LoggerFactory.getLogger(FollowupDispatcher.class);

    private static final int MAX_ERROR_LENGTH = 1000;

    public enum Outcome {
        SENT,
        RETRY,
        FAILED,
        SKIPPED
    }

    private final FollowupTaskRepository taskRepository;
    private final MessageSender messageSender;
    private final ConversationLogService conversationLog;
    private final Clock clock;
    private final int maxAttempts;
    private final Duration retryBackoff;
    private final int batchSize;

    public FollowupDispatcher(FollowupTaskRepository taskRepository,
                              MessageSender messageSender,
                              ConversationLogService conversationLog,
                              Clock clock,
                              @Value("${leasing.followups.max-attempts:5}") int maxAttempts,
                              @Value("${leasing.followups.retry-backoff:PT5M}") Duration retryBackoff,
                              @Value("${leasing.followups.batch-size:100}") int batchSize) {
        this.taskRepository = taskRepository;
        this.messageSender = messageSender;
        this.conversationLog = conversationLog;
        this.clock = clock;
        this.maxAttempts = maxAttempts;
        this.retryBackoff = retryBackoff;
        this.batchSize = batchSize;
    }

    @Transactional(readOnly = true)
    public List<Long> dueTaskIds() {
        return taskRepository.findDueIds(FollowupTask.Status.PENDING, clock.instant(), PageRequest.of(0, batchSize));
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Outcome dispatch(Long taskId) {
        Optional<FollowupTask> locked = taskRepository.findByIdForUpdate(taskId);
        if (locked.isEmpty()) {
            log.debug("Followup {} disappeared before dispatch", taskId);
            return Outcome.SKIPPED;
        }
        FollowupTask task = locked.get();
        Instant now = clock.instant();
        if (!task.isPending()) {
            log.debug("Followup {} is {}, not sending", taskId, task.getStatus().code());
            return Outcome.SKIPPED;
        }
        if (task.getSendAt().isAfter(now) || (task.getNextAttemptAt() != null && task.getNextAttemptAt().isAfter(now))) {
            return Outcome.SKIPPED;
        }

        Lead lead = task.getLead();
        DeliveryResult result;
        try {
            result = messageSender.send(new OutboundMessage(lead.getPhoneNumber(), task.getContent(), dedupKey(task)));
        } catch (RuntimeException e) {
            log.warn("Sender threw for followup {}", taskId, e);
            result = DeliveryResult.transientFailure(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        task.setAttempts(task.getAttempts() + 1);

        switch (result.outcome()) {
            case SUCCESS:
                task.setStatus(FollowupTask.Status.SENT);
                task.setSentAt(now);
                task.setProviderMessageId(result.providerId());
                task.setNextAttemptAt(null);
                task.setErrorMessage(null);
                conversationLog.logBot(lead, task.getContent(), metadata(task, result));
                log.info("Sent {} to {} (followup {})", task.getMessageType().code(), lead.getPhoneNumber(), taskId);
                return Outcome.SENT;
            case TRANSIENT_FAILURE:
                if (task.getAttempts() >= maxAttempts) {
                    fail(task, "Gave up after " + task.getAttempts() + " attempts: " + result.error());
                    log.error("Followup {} failed after {} attempts: {}", taskId, task.getAttempts(), result.error());
                    return Outcome.FAILED;
                }
                task.setNextAttemptAt(now.plus(retryBackoff.multipliedBy(task.getAttempts())));
                task.setErrorMessage(truncate(result.error()));
                log.warn("Followup {} attempt {} failed ({}), retrying at {}",
                        taskId, task.getAttempts(), result.error(), task.getNextAttemptAt());
                return Outcome.RETRY;
            case PERMANENT_FAILURE:
            default:
                fail(task, result.error());
                log.error("Followup {} permanently failed: {}", taskId, result.error());
                return Outcome.FAILED;
        }
    }

    static String dedupKey(FollowupTask task) {
        return "followup-" + task.getId();
    }

    private void fail(FollowupTask task, String error) {
        task.setStatus(FollowupTask.Status.FAILED);
        task.setNextAttemptAt(null);
        task.setErrorMessage(truncate(StringUtils.defaultIfBlank(error, "delivery failed")));
    }

    private static Map<String, Object> metadata(FollowupTask task, DeliveryResult result) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("followup_id", task.getId());
        meta.put("message_type", task.getMessageType().code());
        if (result.providerId() != null) {
            meta.put("provider_id", result.providerId());
        }
        return meta;
    }

    private static String truncate(String error) {
        return StringUtils.abbreviate(error, MAX_ERROR_LENGTH);
    }
}
