package com.ai.leasing.service;

import com.ai.leasing.component.LeadLockRegistry;
import com.ai.leasing.conversation.LeadEvent;
import com.ai.leasing.conversation.LeadStage;
import com.ai.leasing.dto.AppointmentResponse;
import com.ai.leasing.dto.QualificationResponse;
import com.ai.leasing.entity.Appointment;
import com.ai.leasing.exception.InvalidTransitionException;
import com.ai.leasing.exception.NotFoundException;
import com.ai.leasing.exception.SchedulingException;
import com.ai.leasing.repository.AppointmentRepository;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Entry point for everything that changes a lead. Each call takes the lead's lock and
 * keeps it until the transaction started underneath has committed.
 */
@Service
@RequiredArgsConstructor
public class LeadQualificationService {

    private static final Logger log = LoggerFactory.getLogger(LeadQualificationService.class);

    private final LeadLockRegistry locks;
    private final LeadTransitionService transitions;
    private final AppointmentScheduler appointmentScheduler;
    private final AppointmentRepository appointmentRepository;

    public QualificationResponse handleEvent(String phone, LeadEvent event, InboundContext context) {
        String key = normalizePhone(phone);
        return locks.withLead(key, () -> {
            try {
                return transitions.applyEvent(key, event, context == null ? InboundContext.none() : context);
            } catch (InvalidTransitionException e) {
                log.warn("Rejected {} for {} in stage {}: {}", event.type(), key, e.getCurrentStage().code(), e.getMessage());
                throw e;
            }
        });
    }

    /**
     * Books a tour, or moves the existing one when the lead already has a tour booked.
     * A failed first booking puts the lead back to qualified before the error is rethrown.
     */
    public AppointmentResponse requestTour(String phone, Long unitId, Instant scheduledTime) {
        String key = normalizePhone(phone);
        return locks.withLead(key, () -> {
            LeadStage stage = transitions.currentStage(key);
            if (stage == LeadStage.TOUR_SCHEDULED) {
                return transitions.rescheduleTour(key, unitId, scheduledTime);
            }
            if (stage != LeadStage.SCHEDULING_IN_PROGRESS) {
                handleEventLocked(key, new LeadEvent.TourRequested());
            }
            try {
                return transitions.bookTour(key, unitId, scheduledTime);
            } catch (SchedulingException e) {
                log.warn("Tour booking for {} failed ({}): {}", key, e.getReason(), e.getMessage());
                transitions.applyEvent(key, new LeadEvent.TourBookingFailed(e.getReason().name()), InboundContext.none());
                throw e;
            }
        });
    }

    public Appointment cancelAppointment(Long appointmentId) {
        return withAppointmentLead(appointmentId,
                () -> appointmentScheduler.cancel(appointmentId, AppointmentScheduler.CancelSource.LOCAL));
    }

    public Appointment completeAppointment(Long appointmentId) {
        return withAppointmentLead(appointmentId, () -> appointmentScheduler.markCompleted(appointmentId));
    }

    public Appointment markNoShow(Long appointmentId) {
        return withAppointmentLead(appointmentId, () -> appointmentScheduler.markNoShow(appointmentId));
    }

    /**
     * Routes a calendar notification to the matching appointment.
     *
     * @return false when the event id is unknown or the event type is not handled
     */
    public boolean handleCalendarEvent(String eventType, String externalEventId) {
        if (StringUtils.isBlank(externalEventId)) {
            log.warn("Calendar event {} without event id ignored", eventType);
            return false;
        }
        Optional<Appointment> appointment = appointmentRepository.findByExternalEventId(externalEventId);
        if (appointment.isEmpty()) {
            log.warn("Calendar event {} for unknown event {}", eventType, externalEventId);
            return false;
        }
        Long id = appointment.get().getId();
        switch (StringUtils.defaultString(eventType)) {
            case "invitee.canceled":
                withAppointmentLead(id, () -> appointmentScheduler.cancel(id, AppointmentScheduler.CancelSource.CALENDAR));
                return true;
            case "invitee_no_show.created":
                markNoShow(id);
                return true;
            case "event.completed":
                completeAppointment(id);
                return true;
            default:
                log.info("Unhandled calendar event type: {}", eventType);
                return false;
        }
    }

    private void handleEventLocked(String key, LeadEvent event) {
        try {
            transitions.applyEvent(key, event, InboundContext.none());
        } catch (InvalidTransitionException e) {
            log.warn("Rejected {} for {} in stage {}: {}", event.type(), key, e.getCurrentStage().code(), e.getMessage());
            throw e;
        }
    }

    private Appointment withAppointmentLead(Long appointmentId, Supplier<Appointment> work) {
        String phone = appointmentRepository.findLeadPhoneByAppointmentId(appointmentId)
                .orElseThrow(() -> new NotFoundException("Appointment " + appointmentId + " not found"));
        return locks.withLead(phone, work);
    }

    static String normalizePhone(String phone) {
        String trimmed = StringUtils.trimToEmpty(phone);
        if (trimmed.startsWith("whatsapp:")) {
            trimmed = trimmed.substring("whatsapp:".length());
        }
        trimmed = StringUtils.deleteWhitespace(trimmed);
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("phone is required");
        }
        return trimmed;
    }
}
