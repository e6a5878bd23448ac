package com.ai.leasing.entity;

import com.ai.leasing.entity.converter.MessageDirectionConverter;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * Append-only conversation log entry. Rows are never updated.
 */
@Entity
@Immutable
@Table(name = "conversation_log", indexes = {
    @Index(name = "idx_conversation_lead_timestamp", columnList = "lead_id, timestamp"),
    @Index(name = "idx_conversation_message_id", columnList = "message_id")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class ConversationMessage {

    public enum Direction implements CodedEnum {
        USER("user"), BOT("bot");

        private final String code;

        Direction(String code) {
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

    @Convert(converter = MessageDirectionConverter.class)
    @Column(name = "message_type", nullable = false, length = 10)
    private Direction direction;

    @Column(nullable = false, columnDefinition = "text")
    private String content;

    /** Transport message id, when the channel supplied one. */
    @Column(name = "message_id")
    private String messageId;

    @Column(name = "timestamp", nullable = false)
    private Instant timestamp;

    /** Opaque JSON. */
    @Column(columnDefinition = "text")
    private String metadata;

    @PrePersist
    protected void onCreate() {
        if (timestamp == null) timestamp = Instant.now();
    }
}
