package com.ai.leasing.entity;

import com.ai.leasing.entity.converter.AppointmentStatusConverter;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Duration;
import java.time.Instant;

@Entity
@Table(name = "appointments", indexes = {
    @Index(name = "idx_appointments_scheduled_time", columnList = "scheduled_time"),
    @Index(name = "idx_appointments_lead_id", columnList = "lead_id"),
    @Index(name = "idx_appointments_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Appointment {

    public enum Status implements CodedEnum {
        SCHEDULED("scheduled"), COMPLETED("completed"), CANCELED("canceled"), NO_SHOW("no_show");

        private final String code;

        Status(String code) {
            this.code = code;
        }

        @Override
        public String code() {
            return code;
        }
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "lead_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Lead lead;

    /** Nulled, not deleted, when the unit goes away. */
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "unit_id")
    @OnDelete(action = OnDeleteAction.SET_NULL)
    private Unit unit;

    @Column(name = "calendly_event_id", unique = true)
    private String externalEventId;

    @Column(name = "scheduled_time", nullable = false)
    private Instant scheduledTime;

    @Column(name = "duration_minutes", nullable = false)
    @Builder.Default
    private int durationMinutes = 30;

    @Column(name = "attendee_email")
    private String attendeeEmail;

    @Column(name = "attendee_name")
    private String attendeeName;

    @Column(columnDefinition = "text")
    private String location;

    @Convert(converter = AppointmentStatusConverter.class)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private Status status = Status.SCHEDULED;

    @Column(columnDefinition = "text")
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "canceled_at")
    private Instant canceledAt;

    public Instant getEndTime() {
        return scheduledTime.plus(Duration.ofMinutes(durationMinutes));
    }

    public boolean overlaps(Instant start, Instant end) {
        return scheduledTime.isBefore(end) && getEndTime().isAfter(start);
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        if (updatedAt == null) updatedAt = createdAt;
    }
}
