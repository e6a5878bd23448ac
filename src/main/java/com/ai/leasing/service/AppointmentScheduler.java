package com.ai.leasing.service;

import com.ai.leasing.entity.Appointment;
import com.ai.leasing.entity.Lead;
import com.ai.leasing.entity.Property;
import com.ai.leasing.entity.Unit;
import com.ai.leasing.exception.NotFoundException;
import com.ai.leasing.exception.SchedulingException;
import com.ai.leasing.exception.SchedulingException.Reason;
import com.ai.leasing.integration.CalendarClient;
import com.ai.leasing.integration.CalendarException;
import com.ai.leasing.integration.TourBooking;
import com.ai.leasing.repository.AppointmentRepository;
import com.ai.leasing.repository.UnitRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Tour bookings. Every operation runs in the caller's lead lock and in one transaction;
 * on any failure nothing of the attempt is committed and an external event created on
 * the way is canceled again.
 */
@Service
public class AppointmentScheduler {

    private static final Logger log = LoggerFactory.getLogger(AppointmentScheduler.class);

    public enum CancelSource {
        /** Requested through this service; the calendar has to be told. */
        LOCAL,
        /** Reported by the calendar itself. */
        CALENDAR
    }

    private final AppointmentRepository appointmentRepository;
    private final UnitRepository unitRepository;
    private final FollowupScheduler followupScheduler;
    private final CalendarClient calendarClient;
    private final Clock clock;
    private final int tourMinutes;

    public AppointmentScheduler(AppointmentRepository appointmentRepository,
                                UnitRepository unitRepository,
                                FollowupScheduler followupScheduler,
                                CalendarClient calendarClient,
                                Clock clock,
                                @Value("${leasing.tours.duration-minutes:30}") int tourMinutes) {
        this.appointmentRepository = appointmentRepository;
        this.unitRepository = unitRepository;
        this.followupScheduler = followupScheduler;
        this.calendarClient = calendarClient;
        this.clock = clock;
        this.tourMinutes = tourMinutes;
    }

    /**
     * Books a tour of {@code unitId} for the lead, replacing the lead's current tour if it has one.
     *
     * @throws SchedulingException when the slot, the unit or the calendar refuses the booking
     */
    @Transactional
    public Appointment propose(Lead lead, Long unitId, Instant scheduledTime) {
        Instant now = clock.instant();
        if (scheduledTime == null || !scheduledTime.isAfter(now)) {
            throw new SchedulingException(Reason.INVALID_SLOT, "Tour time must be in the future");
        }
        Instant end = scheduledTime.plus(Duration.ofMinutes(tourMinutes));
        Unit unit = lockAvailableUnit(lead, unitId, scheduledTime, end);

        Optional<Appointment> prior = appointmentRepository
                .findFirstByLead_IdAndStatusOrderByIdDesc(lead.getId(), Appointment.Status.SCHEDULED);
        prior.ifPresent(p -> {
            markCanceled(p, now);
            followupScheduler.cancelPendingFor(p);
        });

        Appointment appointment = appointmentRepository.saveAndFlush(Appointment.builder()
                .lead(lead)
                .unit(unit)
                .scheduledTime(scheduledTime)
                .durationMinutes(tourMinutes)
                .attendeeName(lead.getName())
                .attendeeEmail(lead.getEmail())
                .location(location(unit))
                .status(Appointment.Status.SCHEDULED)
                .createdAt(now)
                .updatedAt(now)
                .build());

        String externalId = createExternalEvent(lead, appointment);
        try {
            appointment.setExternalEventId(externalId);
            appointmentRepository.saveAndFlush(appointment);

            String priorExternal = prior.map(Appointment::getExternalEventId).orElse(null);
            if (priorExternal != null) {
                try {
                    calendarClient.cancelEvent(priorExternal, "Rescheduled");
                } catch (CalendarException e) {
                    throw toSchedulingException("Could not cancel previous calendar event " + priorExternal, e);
                }
            }
            followupScheduler.schedule(lead, appointment);
        } catch (DataIntegrityViolationException e) {
            compensate(externalId);
            throw new SchedulingException(Reason.CALENDAR_REJECTED,
                    "Calendar event " + externalId + " is already linked to another appointment", e);
        } catch (RuntimeException e) {
            compensate(externalId);
            throw e;
        }

        log.info("Tour {} booked for lead {} on unit {} at {}{}", appointment.getId(), lead.getPhoneNumber(),
                unitId, scheduledTime, prior.map(p -> " (replaces " + p.getId() + ")").orElse(""));
        return appointment;
    }

    /**
     * Cancels a tour and its pending reminders. Canceling an already canceled tour does nothing.
     * A cancellation reported by the calendar also queues a notice to the lead.
     */
    @Transactional
    public Appointment cancel(Long appointmentId, CancelSource source) {
        Appointment appointment = lock(appointmentId);
        if (appointment.getStatus() == Appointment.Status.CANCELED) {
            log.debug("Appointment {} already canceled", appointmentId);
            return appointment;
        }
        if (appointment.getStatus() != Appointment.Status.SCHEDULED) {
            throw new SchedulingException(Reason.INVALID_STATE,
                    "Appointment " + appointmentId + " is " + appointment.getStatus().code() + " and cannot be canceled");
        }
        markCanceled(appointment, clock.instant());
        followupScheduler.cancelPendingFor(appointment);

        if (source == CancelSource.LOCAL && appointment.getExternalEventId() != null) {
            try {
                calendarClient.cancelEvent(appointment.getExternalEventId(), "Canceled by lead");
            } catch (CalendarException e) {
                throw toSchedulingException("Could not cancel calendar event " + appointment.getExternalEventId(), e);
            }
        }
        if (source == CancelSource.CALENDAR) {
            followupScheduler.scheduleCancellationNotice(appointment.getLead(), appointment);
        }
        log.info("Appointment {} canceled ({})", appointmentId, source);
        return appointment;
    }

    @Transactional
    public Appointment markCompleted(Long appointmentId) {
        Appointment appointment = lock(appointmentId);
        if (appointment.getStatus() == Appointment.Status.COMPLETED) {
            return appointment;
        }
        requireScheduled(appointment, "completed");
        Instant now = clock.instant();
        appointment.setStatus(Appointment.Status.COMPLETED);
        appointment.setCompletedAt(now);
        appointment.setUpdatedAt(now);
        followupScheduler.cancelPendingFor(appointment);
        followupScheduler.scheduleAfterTour(appointment.getLead(), appointment);
        log.info("Appointment {} completed", appointmentId);
        return appointment;
    }

    @Transactional
    public Appointment markNoShow(Long appointmentId) {
        Appointment appointment = lock(appointmentId);
        if (appointment.getStatus() == Appointment.Status.NO_SHOW) {
            return appointment;
        }
        requireScheduled(appointment, "no_show");
        appointment.setStatus(Appointment.Status.NO_SHOW);
        appointment.setUpdatedAt(clock.instant());
        followupScheduler.cancelPendingFor(appointment);
        followupScheduler.scheduleNoShow(appointment.getLead(), appointment);
        log.info("Appointment {} marked no-show", appointmentId);
        return appointment;
    }

    private Unit lockAvailableUnit(Lead lead, Long unitId, Instant start, Instant end) {
        if (unitId == null) {
            throw new SchedulingException(Reason.UNIT_NOT_FOUND, "A unit is required to book a tour");
        }
        Unit unit = unitRepository.findByIdForUpdate(unitId)
                .orElseThrow(() -> new SchedulingException(Reason.UNIT_NOT_FOUND, "Unit " + unitId + " not found"));
        if (unit.getStatus() != Unit.Status.AVAILABLE) {
            throw new SchedulingException(Reason.UNIT_UNAVAILABLE,
                    "Unit " + unitId + " is " + unit.getStatus().code());
        }
        boolean taken = appointmentRepository
                .findUnitToursStartingBefore(unitId, lead.getId(), Appointment.Status.SCHEDULED, end)
                .stream()
                .anyMatch(other -> other.overlaps(start, end));
        if (taken) {
            throw new SchedulingException(Reason.UNIT_UNAVAILABLE, "Unit " + unitId + " already has a tour at that time");
        }
        return unit;
    }

    private String createExternalEvent(Lead lead, Appointment appointment) {
        TourBooking booking = new TourBooking(
                appointment.getScheduledTime(),
                appointment.getDurationMinutes(),
                new TourBooking.Attendee(lead.getName(), lead.getEmail(), lead.getPhoneNumber()),
                appointment.getLocation(),
                "Apartment tour" + (appointment.getUnit() != null ? " - unit " + appointment.getUnit().getUnitNumber() : ""));
        try {
            return calendarClient.createEvent(booking);
        } catch (CalendarException e) {
            throw toSchedulingException("Calendar did not accept the tour", e);
        }
    }

    private void compensate(String externalId) {
        try {
            calendarClient.cancelEvent(externalId, "Booking rolled back");
            log.warn("Rolled back calendar event {}", externalId);
        } catch (CalendarException e) {
            log.error("Calendar event {} is orphaned: rollback cancel failed", externalId, e);
        }
    }

    private Appointment lock(Long appointmentId) {
        return appointmentRepository.findByIdForUpdate(appointmentId)
                .orElseThrow(() -> new NotFoundException("Appointment " + appointmentId + " not found"));
    }

    private static void requireScheduled(Appointment appointment, String target) {
        if (appointment.getStatus() != Appointment.Status.SCHEDULED) {
            throw new SchedulingException(Reason.INVALID_STATE, "Appointment " + appointment.getId() + " is "
                    + appointment.getStatus().code() + " and cannot become " + target);
        }
    }

    private static void markCanceled(Appointment appointment, Instant now) {
        appointment.setStatus(Appointment.Status.CANCELED);
        appointment.setCanceledAt(now);
        appointment.setUpdatedAt(now);
    }

    private static String location(Unit unit) {
        Property property = unit.getProperty();
        if (property == null) return null;
        return StringUtils.isNotBlank(property.getAddress()) ? property.getAddress() : property.getName();
    }

    private static SchedulingException toSchedulingException(String message, CalendarException e) {
        Reason reason;
        switch (e.getKind()) {
            case REJECTED:
                reason = Reason.CALENDAR_REJECTED;
                break;
            case TIMEOUT:
                reason = Reason.CALENDAR_TIMEOUT;
                break;
            default:
                reason = Reason.CALENDAR_UNAVAILABLE;
        }
        return new SchedulingException(reason, message + ": " + e.getMessage(), e);
    }
}
