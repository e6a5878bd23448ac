package com.ai.leasing.service;

import com.ai.leasing.component.LeasingPhrases;
import com.ai.leasing.conversation.LeadStage;
import com.ai.leasing.dto.DispatchSummary;
import com.ai.leasing.entity.Appointment;
import com.ai.leasing.entity.FollowupMessageType;
import com.ai.leasing.entity.FollowupTask;
import com.ai.leasing.entity.Lead;
import com.ai.leasing.repository.FollowupTaskRepository;
import com.ai.leasing.repository.LeadRepository;
import com.ai.leasing.service.FollowupScheduler.PlannedReminder;
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
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class FollowupSchedulerTest {

    private static final ZoneId ZONE = ZoneId.of("Asia/Jerusalem");
    // 10:00 local, UTC+2 before daylight saving starts
    private static final Instant NOW = Instant.parse("2025-03-10T08:00:00Z");

    @Mock
    private FollowupTaskRepository taskRepository;
    @Mock
    private LeadRepository leadRepository;
    @Mock
    private FollowupDispatcher dispatcher;

    private FollowupScheduler scheduler;
    private Lead lead;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZONE);
        scheduler = new FollowupScheduler(taskRepository, leadRepository, dispatcher, new LeasingPhrases(clock), clock,
                19, 9, Duration.ofHours(3), Duration.ofHours(4), Duration.ofHours(2), Duration.ofMinutes(15));
        lead = Lead.builder().id(7L).phoneNumber("+972501234567").name("Dana").build();
        when(taskRepository.saveAll(anyList())).thenAnswer(inv -> inv.getArgument(0));
        when(taskRepository.save(any(FollowupTask.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void plansThreeRemindersInLocalTime() {
        // 14:00 local on the 12th
        List<PlannedReminder> plan = scheduler.planReminders(Instant.parse("2025-03-12T12:00:00Z"), NOW);

        assertThat(plan).containsExactly(
                new PlannedReminder(FollowupMessageType.EVENING_BEFORE_REMINDER, Instant.parse("2025-03-11T17:00:00Z")),
                new PlannedReminder(FollowupMessageType.MORNING_OF_REMINDER, Instant.parse("2025-03-12T07:00:00Z")),
                new PlannedReminder(FollowupMessageType.THREE_HOURS_BEFORE_REMINDER, Instant.parse("2025-03-12T09:00:00Z")));
    }

    @Test
    void morningReminderSkippedForEarlyTour() {
        // 09:00 local, same as the morning reminder hour
        List<PlannedReminder> plan = scheduler.planReminders(Instant.parse("2025-03-12T07:00:00Z"), NOW);

        assertThat(plan).extracting(PlannedReminder::type).containsExactly(
                FollowupMessageType.EVENING_BEFORE_REMINDER,
                FollowupMessageType.THREE_HOURS_BEFORE_REMINDER);
    }

    @Test
    void remindersInThePastAreDropped() {
        // 15:00 local today: evening and morning already passed, three-hours mark is 12:00 local
        List<PlannedReminder> plan = scheduler.planReminders(Instant.parse("2025-03-10T13:00:00Z"), NOW);

        assertThat(plan).containsExactly(
                new PlannedReminder(FollowupMessageType.THREE_HOURS_BEFORE_REMINDER, Instant.parse("2025-03-10T10:00:00Z")));
    }

    @Test
    void scheduleCreatesPendingRemindersWithContent() {
        Appointment appointment = appointment(Instant.parse("2025-03-12T12:00:00Z"));

        List<FollowupTask> tasks = scheduler.schedule(lead, appointment);

        assertThat(tasks).hasSize(3);
        assertThat(tasks).allSatisfy(t -> {
            assertThat(t.getStatus()).isEqualTo(FollowupTask.Status.PENDING);
            assertThat(t.getLead()).isSameAs(lead);
            assertThat(t.getAppointment()).isSameAs(appointment);
            assertThat(t.getContent()).contains("14:00");
        });
    }

    @Test
    void scheduleSkipsRemindersAlreadyPending() {
        Appointment appointment = appointment(Instant.parse("2025-03-12T12:00:00Z"));
        when(taskRepository.existsByLead_IdAndAppointment_IdAndMessageTypeAndStatus(
                7L, 11L, FollowupMessageType.MORNING_OF_REMINDER, FollowupTask.Status.PENDING)).thenReturn(true);

        List<FollowupTask> tasks = scheduler.schedule(lead, appointment);

        assertThat(tasks).extracting(FollowupTask::getMessageType).containsExactly(
                FollowupMessageType.EVENING_BEFORE_REMINDER,
                FollowupMessageType.THREE_HOURS_BEFORE_REMINDER);
    }

    @Test
    void cancelPendingForTransitionsOnlyPendingTasks() {
        when(taskRepository.transitionForAppointment(11L, FollowupTask.Status.PENDING, FollowupTask.Status.CANCELED))
                .thenReturn(3);

        assertThat(scheduler.cancelPendingFor(appointment(Instant.parse("2025-03-12T12:00:00Z")))).isEqualTo(3);
    }

    @Test
    void afterTourFollowupIsDueTwoHoursAfterTheTourEnds() {
        Appointment appointment = appointment(Instant.parse("2025-03-10T06:00:00Z"));

        Optional<FollowupTask> task = scheduler.scheduleAfterTour(lead, appointment);

        assertThat(task).isPresent();
        assertThat(task.get().getMessageType()).isEqualTo(FollowupMessageType.FOLLOW_UP_AFTER_TOUR);
        assertThat(task.get().getSendAt()).isEqualTo(Instant.parse("2025-03-10T08:30:00Z"));
    }

    @Test
    void cancellationNoticeIsDueImmediately() {
        Optional<FollowupTask> task = scheduler.scheduleCancellationNotice(lead,
                appointment(Instant.parse("2025-03-12T12:00:00Z")));

        assertThat(task).isPresent();
        assertThat(task.get().getMessageType()).isEqualTo(FollowupMessageType.TOUR_CANCELED_NOTICE);
        assertThat(task.get().getSendAt()).isEqualTo(NOW);
        assertThat(task.get().getContent()).isEqualTo(new LeasingPhrases(Clock.fixed(NOW, ZONE)).tourCanceled());
    }

    @Test
    void cancellationNoticeNotQueuedTwice() {
        when(taskRepository.existsByLead_IdAndAppointment_IdAndMessageTypeAndStatus(
                7L, 11L, FollowupMessageType.TOUR_CANCELED_NOTICE, FollowupTask.Status.PENDING)).thenReturn(true);

        Optional<FollowupTask> task = scheduler.scheduleCancellationNotice(lead,
                appointment(Instant.parse("2025-03-12T12:00:00Z")));

        assertThat(task).isEmpty();
        verify(taskRepository, never()).save(any(FollowupTask.class));
    }

    @Test
    void noShowFollowupUsesShortDelay() {
        Optional<FollowupTask> task = scheduler.scheduleNoShow(lead, appointment(Instant.parse("2025-03-10T07:00:00Z")));

        assertThat(task).map(FollowupTask::getSendAt).contains(NOW.plus(Duration.ofMinutes(15)));
    }

    @Test
    void nudgeQueuedOnceForSilentLead() {
        lead.setStage(LeadStage.COLLECTING_PROFILE);
        lead.setLastInteraction(NOW.minus(Duration.ofHours(5)));
        when(leadRepository.findByPhoneNumber("+972501234567")).thenReturn(Optional.of(lead));

        assertThat(scheduler.nudgeIfInactive("+972501234567")).isTrue();

        ArgumentCaptor<FollowupTask> saved = ArgumentCaptor.forClass(FollowupTask.class);
        verify(taskRepository).save(saved.capture());
        assertThat(saved.getValue().getMessageType()).isEqualTo(FollowupMessageType.ABANDONED_LEAD_NUDGE);
        assertThat(saved.getValue().getAppointment()).isNull();
        assertThat(saved.getValue().getSendAt()).isEqualTo(NOW);

        when(taskRepository.existsByLead_IdAndMessageTypeAndCreatedAtAfter(
                eq(7L), eq(FollowupMessageType.ABANDONED_LEAD_NUDGE), any())).thenReturn(true);
        assertThat(scheduler.nudgeIfInactive("+972501234567")).isFalse();
    }

    @Test
    void noNudgeForRecentOrTerminalLeads() {
        lead.setStage(LeadStage.COLLECTING_PROFILE);
        lead.setLastInteraction(NOW.minus(Duration.ofHours(1)));
        when(leadRepository.findByPhoneNumber("+972501234567")).thenReturn(Optional.of(lead));
        assertThat(scheduler.nudgeIfInactive("+972501234567")).isFalse();

        lead.setStage(LeadStage.NO_FIT);
        lead.setLastInteraction(NOW.minus(Duration.ofDays(1)));
        assertThat(scheduler.nudgeIfInactive("+972501234567")).isFalse();

        verify(taskRepository, never()).save(any(FollowupTask.class));
    }

    @Test
    void dispatchCycleContinuesPastFailures() {
        when(dispatcher.dueTaskIds()).thenReturn(List.of(1L, 2L, 3L, 4L));
        when(dispatcher.dispatch(1L)).thenReturn(FollowupDispatcher.Outcome.SENT);
        when(dispatcher.dispatch(2L)).thenThrow(new IllegalStateException("boom"));
        when(dispatcher.dispatch(3L)).thenReturn(FollowupDispatcher.Outcome.RETRY);
        when(dispatcher.dispatch(4L)).thenReturn(FollowupDispatcher.Outcome.SKIPPED);

        DispatchSummary summary = scheduler.dispatchDue();

        assertThat(summary.getPicked()).isEqualTo(4);
        assertThat(summary.getSent()).isEqualTo(1);
        assertThat(summary.getErrors()).isEqualTo(1);
        assertThat(summary.getRetried()).isEqualTo(1);
        assertThat(summary.getSkipped()).isEqualTo(1);
    }

    private Appointment appointment(Instant scheduledTime) {
        return Appointment.builder().id(11L).lead(lead).scheduledTime(scheduledTime).build();
    }
}
