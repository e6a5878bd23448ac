package com.ai.leasing.entity;

import com.ai.leasing.entity.converter.FollowupMessageTypeConverter;
import com.ai.leasing.entity.converter.FollowupStatusConverter;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "followups", indexes = {
    @Index(name = "idx_followups_status_send_at", columnList = "status, send_at"),
    @Index(name = "idx_followups_lead_id", columnList = "lead_id"),
    @Index(name = "idx_followups_appointment_id", columnList = "appointment_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FollowupTask {

    public enum Status implements CodedEnum {
        PENDING("pending"), SENT("sent"), FAILED("failed"), CANCELED("canceled");

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
    private Lead lead;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "appointment_id")
    private Appointment appointment;

    @Convert(converter = FollowupMessageTypeConverter.class)
    @Column(name = "message_type", nullable = false, length = 40)
    private FollowupMessageType messageType;

    @Column(columnDefinition = "text")
    private String content;

    @Column(name = "send_at", nullable = false)
    private Instant sendAt;

    @Convert(converter = FollowupStatusConverter.class)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private Status status = Status.PENDING;

    @Column(name = "sent_at")
    private Instant sentAt;

    /** Provider id of the delivered message, set together with the sent status. */
    @Column(name = "provider_message_id", length = 64)
    private String providerMessageId;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @Column(nullable = false)
    @Builder.Default
    private int attempts = 0;

    /** Earliest retry time after a transient failure; null until the first failure. */
    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public boolean isPending() {
        return status == Status.PENDING;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
