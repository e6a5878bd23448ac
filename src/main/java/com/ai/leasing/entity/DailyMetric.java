package com.ai.leasing.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "metrics_daily")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DailyMetric {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "date", nullable = false, unique = true)
    private LocalDate date;

    @Column(name = "total_inquiries", nullable = false)
    private int totalInquiries;

    @Column(name = "qualified_leads", nullable = false)
    private int qualifiedLeads;

    @Column(name = "tours_scheduled", nullable = false)
    private int toursScheduled;

    @Column(name = "tours_completed", nullable = false)
    private int toursCompleted;

    /** Qualified leads per inquiry, as a percentage with two decimals. */
    @Column(name = "conversion_rate_qualified", nullable = false, precision = 7, scale = 2)
    private BigDecimal conversionRateQualified;

    /** Tours scheduled per qualified lead, as a percentage. May exceed 100. */
    @Column(name = "conversion_rate_tours", nullable = false, precision = 7, scale = 2)
    private BigDecimal conversionRateTours;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        if (updatedAt == null) updatedAt = createdAt;
    }
}
