package com.ai.leasing.service;

import com.ai.leasing.entity.FollowupMessageType;
import com.ai.leasing.entity.FollowupTask;
import com.ai.leasing.entity.Lead;
import com.ai.leasing.integration.DeliveryResult;
import com.ai.leasing.integration.MessageSender;
import com.ai.leasing.integration.OutboundMessage;
import com.ai.leasing.repository.FollowupTaskRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class FollowupDispatcherTest {

    private static final Instant NOW = Instant.parse("2025-03-10T08:00:00Z");

    @Mock
    private FollowupTaskRepository taskRepository;
    @Mock
    private MessageSender messageSender;
    @Mock
    private ConversationLogService conversationLog;

    private FollowupDispatcher dispatcher;
    private Lead lead;

    @BeforeEach
    void setUp() {
        dispatcher = new FollowupDispatcher(taskRepository, messageSender, conversationLog,
                Clock.fixed(NOW, ZoneOffset.UTC), 3, Duration.ofMinutes(5), 50);
        lead = Lead.builder().id(1L).phoneNumber("+972501234567").name("Dana").build();
    }

    @Test
    void successfulSendMarksTaskSentAndLogsIt() {
        FollowupTask task = dueTask(10L);
        when(messageSender.send(any())).thenReturn(DeliveryResult.success("SM123"));

        assertThat(dispatcher.dispatch(10L)).isEqualTo(FollowupDispatcher.Outcome.SENT);

        assertThat(task.getStatus()).isEqualTo(FollowupTask.Status.SENT);
        assertThat(task.getSentAt()).isEqualTo(NOW);
        assertThat(task.getAttempts()).isEqualTo(1);
        assertThat(task.getProviderMessageId()).isEqualTo("SM123");
        ArgumentCaptor<OutboundMessage> sent = ArgumentCaptor.forClass(OutboundMessage.class);
        verify(messageSender).send(sent.capture());
        assertThat(sent.getValue().phone()).isEqualTo("+972501234567");
        assertThat(sent.getValue().dedupKey()).isEqualTo("followup-10");
        verify(conversationLog).logBot(eq(lead), eq("See you tomorrow"), anyMap());
    }

    @Test
    void transientFailureSchedulesRetryWithGrowingBackoff() {
        FollowupTask task = dueTask(10L);
        task.setAttempts(1);
        when(messageSender.send(any())).thenReturn(DeliveryResult.transientFailure("timeout"));

        assertThat(dispatcher.dispatch(10L)).isEqualTo(FollowupDispatcher.Outcome.RETRY);

        assertThat(task.getStatus()).isEqualTo(FollowupTask.Status.PENDING);
        assertThat(task.getAttempts()).isEqualTo(2);
        assertThat(task.getNextAttemptAt()).isEqualTo(NOW.plus(Duration.ofMinutes(10)));
        assertThat(task.getErrorMessage()).isEqualTo("timeout");
        verify(conversationLog, never()).logBot(any(), any(), anyMap());
    }

    @Test
    void givesUpAfterMaxAttempts() {
        FollowupTask task = dueTask(10L);
        task.setAttempts(2);
        when(messageSender.send(any())).thenReturn(DeliveryResult.transientFailure("timeout"));

        assertThat(dispatcher.dispatch(10L)).isEqualTo(FollowupDispatcher.Outcome.FAILED);

        assertThat(task.getStatus()).isEqualTo(FollowupTask.Status.FAILED);
        assertThat(task.getErrorMessage()).startsWith("Gave up after 3 attempts");
        assertThat(task.getNextAttemptAt()).isNull();
    }

    @Test
    void permanentFailureFailsImmediately() {
        FollowupTask task = dueTask(10L);
        when(messageSender.send(any())).thenReturn(DeliveryResult.permanentFailure("invalid number"));

        assertThat(dispatcher.dispatch(10L)).isEqualTo(FollowupDispatcher.Outcome.FAILED);

        assertThat(task.getStatus()).isEqualTo(FollowupTask.Status.FAILED);
        assertThat(task.getErrorMessage()).isEqualTo("invalid number");
    }

    @Test
    void senderExceptionCountsAsTransient() {
        FollowupTask task = dueTask(10L);
        when(messageSender.send(any())).thenThrow(new IllegalStateException("socket closed"));

        assertThat(dispatcher.dispatch(10L)).isEqualTo(FollowupDispatcher.Outcome.RETRY);
        assertThat(task.getErrorMessage()).contains("socket closed");
    }

    @Test
    void canceledTaskIsNotSent() {
        FollowupTask task = dueTask(10L);
        task.setStatus(FollowupTask.Status.CANCELED);

        assertThat(dispatcher.dispatch(10L)).isEqualTo(FollowupDispatcher.Outcome.SKIPPED);
        verifyNoInteractions(messageSender);
    }

    @Test
    void taskDeliveredBeforeRestartIsNotSentAgain() {
        FollowupTask task = dueTask(10L);
        task.setStatus(FollowupTask.Status.SENT);
        task.setProviderMessageId("SM123");
        FollowupDispatcher afterRestart = new FollowupDispatcher(taskRepository, messageSender, conversationLog,
                Clock.fixed(NOW.plusSeconds(600), ZoneOffset.UTC), 3, Duration.ofMinutes(5), 50);

        assertThat(afterRestart.dispatch(10L)).isEqualTo(FollowupDispatcher.Outcome.SKIPPED);
        verifyNoInteractions(messageSender);
        assertThat(task.getProviderMessageId()).isEqualTo("SM123");
    }

    @Test
    void taskWaitingForBackoffIsNotSent() {
        FollowupTask task = dueTask(10L);
        task.setNextAttemptAt(NOW.plusSeconds(60));

        assertThat(dispatcher.dispatch(10L)).isEqualTo(FollowupDispatcher.Outcome.SKIPPED);
        verifyNoInteractions(messageSender);
    }

    @Test
    void missingTaskIsSkipped() {
        when(taskRepository.findByIdForUpdate(99L)).thenReturn(Optional.empty());

        assertThat(dispatcher.dispatch(99L)).isEqualTo(FollowupDispatcher.Outcome.SKIPPED);
    }

    private FollowupTask dueTask(Long id) {
        FollowupTask task = FollowupTask.builder()
                .id(id)
                .lead(lead)
                .messageType(FollowupMessageType.EVENING_BEFORE_REMINDER)
                .content("See you tomorrow")
                .sendAt(NOW.minusSeconds(30))
                .createdAt(NOW.minusSeconds(3600))
                .build();
        when(taskRepository.findByIdForUpdate(id)).thenReturn(Optional.of(task));
        return task;
    }
}
