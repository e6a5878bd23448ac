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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Creates and cancels followup tasks. Delivery itself is done by {@link FollowupDispatcher},
 * one task per transaction.
 */
@Service
public class FollowupScheduler {

    private static final Logger log = LoggerFactory.getLogger(FollowupScheduler.class);

    /** Stages in which a silent lead is still worth a nudge. */
    static final Set<LeadStage> NUDGE_STAGES = EnumSet.of(
            LeadStage.GATE_QUESTION_PAYSLIPS,
            LeadStage.GATE_QUESTION_DEPOSIT,
            LeadStage.GATE_QUESTION_MOVE_DATE,
            LeadStage.COLLECTING_PROFILE,
            LeadStage.QUALIFIED,
            LeadStage.SCHEDULING_IN_PROGRESS);

    public record PlannedReminder(FollowupMessageType type, Instant sendAt) {
    }

    private final FollowupTaskRepository taskRepository;
    private final LeadRepository leadRepository;
    private final FollowupDispatcher dispatcher;
    private final LeasingPhrases phrases;
    private final Clock clock;
    private final ZoneId zone;

    private final int eveningHour;
    private final int morningHour;
    private final Duration shortReminderOffset;
    private final Duration abandonedAfter;
    private final Duration afterTourDelay;
    private final Duration noShowDelay;

    public FollowupScheduler(FollowupTaskRepository taskRepository,
                             LeadRepository leadRepository,
                             FollowupDispatcher dispatcher,
                             LeasingPhrases phrases,
                             Clock clock,
                             @Value("${leasing.followups.evening-hour:19}") int eveningHour,
                             @Value("${leasing.followups.morning-hour:9}") int morningHour,
                             @Value("${leasing.followups.short-reminder-offset:PT3H}") Duration shortReminderOffset,
                             @Value("${leasing.followups.abandoned-after:PT4H}") Duration abandonedAfter,
                             @Value("${leasing.followups.after-tour-delay:PT2H}") Duration afterTourDelay,
                             @Value("${leasing.followups.no-show-delay:PT15M}") Duration noShowDelay) {
        this.taskRepository = taskRepository;
        this.leadRepository = leadRepository;
        this.dispatcher = dispatcher;
        this.phrases = phrases;
        this.clock = clock;
        this.zone = clock.getZone();
        this.eveningHour = eveningHour;
        this.morningHour = morningHour;
        this.shortReminderOffset = shortReminderOffset;
        this.abandonedAfter = abandonedAfter;
        this.afterTourDelay = afterTourDelay;
        this.noShowDelay = noShowDelay;
    }

    /**
     * Reminder times for a tour, earliest first. Reminders that would fire at or before
     * {@code now} are left out; the morning reminder must also come before the tour.
     */
    public List<PlannedReminder> planReminders(Instant scheduledTime, Instant now) {
        LocalDate tourDay = scheduledTime.atZone(zone).toLocalDate();
        List<PlannedReminder> plan = new ArrayList<>();

        Instant eveningBefore = atLocal(tourDay.minusDays(1), eveningHour);
        if (eveningBefore.isAfter(now)) {
            plan.add(new PlannedReminder(FollowupMessageType.EVENING_BEFORE_REMINDER, eveningBefore));
        }
        Instant morningOf = atLocal(tourDay, morningHour);
        if (morningOf.isAfter(now) && morningOf.isBefore(scheduledTime)) {
            plan.add(new PlannedReminder(FollowupMessageType.MORNING_OF_REMINDER, morningOf));
        }
        Instant shortly = scheduledTime.minus(shortReminderOffset);
        if (shortly.isAfter(now)) {
            plan.add(new PlannedReminder(FollowupMessageType.THREE_HOURS_BEFORE_REMINDER, shortly));
        }
        plan.sort(Comparator.comparing(PlannedReminder::sendAt));
        return plan;
    }

    /**
     * Inserts the tour reminders of an appointment. A reminder already pending for the
     * same lead, appointment and type is not inserted again.
     */
    @Transactional
    public List<FollowupTask> schedule(Lead lead, Appointment appointment) {
        Instant now = clock.instant();
        List<FollowupTask> created = new ArrayList<>();
        for (PlannedReminder reminder : planReminders(appointment.getScheduledTime(), now)) {
            if (isPending(lead, appointment, reminder.type())) {
                continue;
            }
            created.add(FollowupTask.builder()
                    .lead(lead)
                    .appointment(appointment)
                    .messageType(reminder.type())
                    .sendAt(reminder.sendAt())
                    .content(reminderContent(reminder.type(), appointment.getScheduledTime()))
                    .createdAt(now)
                    .build());
        }
        List<FollowupTask> saved = taskRepository.saveAll(created);
        log.info("Scheduled {} reminder(s) for appointment {} of lead {}: {}",
                saved.size(), appointment.getId(), lead.getPhoneNumber(),
                saved.stream().map(t -> t.getMessageType().code()).collect(Collectors.toList()));
        return saved;
    }

    @Transactional
    public Optional<FollowupTask> scheduleAfterTour(Lead lead, Appointment appointment) {
        Instant now = clock.instant();
        Instant due = appointment.getEndTime().plus(afterTourDelay);
        return scheduleOnce(lead, appointment, FollowupMessageType.FOLLOW_UP_AFTER_TOUR,
                due.isAfter(now) ? due : now, phrases.afterTour());
    }

    @Transactional
    public Optional<FollowupTask> scheduleNoShow(Lead lead, Appointment appointment) {
        return scheduleOnce(lead, appointment, FollowupMessageType.NO_SHOW_FOLLOW_UP,
                clock.instant().plus(noShowDelay), phrases.noShow());
    }

    /** Tells the lead that the calendar side canceled their tour. Sent on the next dispatch cycle. */
    @Transactional
    public Optional<FollowupTask> scheduleCancellationNotice(Lead lead, Appointment appointment) {
        return scheduleOnce(lead, appointment, FollowupMessageType.TOUR_CANCELED_NOTICE,
                clock.instant(), phrases.tourCanceled());
    }

    /** Cancels the appointment's pending tasks. Tasks already sent or failed are left alone. */
    @Transactional
    public int cancelPendingFor(Appointment appointment) {
        if (appointment.getId() == null) return 0;
        int canceled = taskRepository.transitionForAppointment(
                appointment.getId(), FollowupTask.Status.PENDING, FollowupTask.Status.CANCELED);
        if (canceled > 0) {
            log.info("Canceled {} pending followup(s) of appointment {}", canceled, appointment.getId());
        }
        return canceled;
    }

    @Transactional
    public int cancelPendingNudges(Lead lead) {
        if (lead.getId() == null) return 0;
        int canceled = taskRepository.transitionForLead(lead.getId(), FollowupMessageType.ABANDONED_LEAD_NUDGE,
                FollowupTask.Status.PENDING, FollowupTask.Status.CANCELED);
        if (canceled > 0) {
            log.debug("Canceled {} pending nudge(s) for lead {}", canceled, lead.getPhoneNumber());
        }
        return canceled;
    }

    /** Phones of leads silent for longer than the abandonment delay in a stage that can still progress. */
    @Transactional(readOnly = true)
    public List<String> findNudgeCandidates() {
        Instant cutoff = clock.instant().minus(abandonedAfter);
        return leadRepository.findInactiveSince(NUDGE_STAGES, cutoff).stream()
                .map(Lead::getPhoneNumber)
                .collect(Collectors.toList());
    }

    /**
     * Queues one nudge for the lead if it is still inactive and has not been nudged since
     * its last interaction. Callers hold the lead's lock.
     */
    @Transactional
    public boolean nudgeIfInactive(String phone) {
        Optional<Lead> found = leadRepository.findByPhoneNumber(phone);
        if (found.isEmpty()) return false;
        Lead lead = found.get();
        Instant now = clock.instant();
        if (!NUDGE_STAGES.contains(lead.getStage())
                || lead.getLastInteraction() == null
                || lead.getLastInteraction().plus(abandonedAfter).isAfter(now)) {
            return false;
        }
        if (taskRepository.existsByLead_IdAndAppointmentIsNullAndMessageTypeAndStatus(
                lead.getId(), FollowupMessageType.ABANDONED_LEAD_NUDGE, FollowupTask.Status.PENDING)
                || taskRepository.existsByLead_IdAndMessageTypeAndCreatedAtAfter(
                lead.getId(), FollowupMessageType.ABANDONED_LEAD_NUDGE, lead.getLastInteraction())) {
            return false;
        }
        taskRepository.save(FollowupTask.builder()
                .lead(lead)
                .messageType(FollowupMessageType.ABANDONED_LEAD_NUDGE)
                .sendAt(now)
                .content(phrases.abandonedNudge())
                .createdAt(now)
                .build());
        log.info("Queued abandoned-lead nudge for {} (stage {}, silent since {})",
                phone, lead.getStage().code(), lead.getLastInteraction());
        return true;
    }

    /**
     * One polling cycle: every due task is handed to the dispatcher in its own transaction.
     * A failure on one task does not stop the others.
     */
    public DispatchSummary dispatchDue() {
        DispatchSummary summary = new DispatchSummary();
        List<Long> due = dispatcher.dueTaskIds();
        summary.picked(due.size());
        for (Long id : due) {
            try {
                switch (dispatcher.dispatch(id)) {
                    case SENT:
                        summary.sent();
                        break;
                    case RETRY:
                        summary.retried();
                        break;
                    case FAILED:
                        summary.failed();
                        break;
                    default:
                        summary.skipped();
                }
            } catch (RuntimeException e) {
                summary.error();
                log.error("Dispatch of followup {} failed, leaving it for the next cycle", id, e);
            }
        }
        return summary;
    }

    private Optional<FollowupTask> scheduleOnce(Lead lead, Appointment appointment, FollowupMessageType type,
                                                Instant sendAt, String content) {
        if (isPending(lead, appointment, type)) {
            return Optional.empty();
        }
        FollowupTask task = taskRepository.save(FollowupTask.builder()
                .lead(lead)
                .appointment(appointment)
                .messageType(type)
                .sendAt(sendAt)
                .content(content)
                .createdAt(clock.instant())
                .build());
        log.info("Scheduled {} for appointment {} at {}", type.code(), appointment.getId(), sendAt);
        return Optional.of(task);
    }

    private boolean isPending(Lead lead, Appointment appointment, FollowupMessageType type) {
        return taskRepository.existsByLead_IdAndAppointment_IdAndMessageTypeAndStatus(
                lead.getId(), appointment.getId(), type, FollowupTask.Status.PENDING);
    }

    private String reminderContent(FollowupMessageType type, Instant tour) {
        switch (type) {
            case EVENING_BEFORE_REMINDER: return phrases.eveningBeforeReminder(tour);
            case MORNING_OF_REMINDER: return phrases.morningOfReminder(tour);
            case THREE_HOURS_BEFORE_REMINDER: return phrases.threeHoursReminder(tour);
            default: throw new IllegalArgumentException(type.code() + " is not a tour reminder");
        }
    }

    private Instant atLocal(LocalDate day, int hour) {
        return ZonedDateTime.of(day.atTime(hour, 0), zone).toInstant();
    }
}
