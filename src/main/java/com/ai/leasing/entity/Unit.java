package com.ai.leasing.entity;

import jakarta.persistence.*;
import lombok.*;

import com.ai.leasing.entity.converter.UnitStatusConverter;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * A rentable unit. Status is owned by the catalogue side (hold / rent actions);
 * the qualification core only reads it.
 */
@Entity
@Table(name = "units", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"property_id", "unit_number"})
}, indexes = {
    @Index(name = "idx_units_status", columnList = "status"),
    @Index(name = "idx_units_price", columnList = "price")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Unit {

    public enum Status implements CodedEnum {
        AVAILABLE("available"), HOLD("hold"), RENTED("rented");

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
    @JoinColumn(name = "property_id", nullable = false)
    private Property property;

    @Column(name = "unit_number", nullable = false, length = 10)
    private String unitNumber;

    @Column(nullable = false)
    private Integer rooms;

    @Column(precision = 3, scale = 1)
    private BigDecimal bathrooms;

    @Column(name = "area_sqm")
    private Integer areaSqm;

    private Integer floor;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Column(name = "deposit_months")
    @Builder.Default
    private Integer depositMonths = 2;

    @Column(name = "has_parking", nullable = false)
    private boolean hasParking;

    @Column(name = "has_balcony", nullable = false)
    private boolean hasBalcony;

    @Column(name = "has_elevator", nullable = false)
    private boolean hasElevator;

    @Column(nullable = false)
    private boolean furnished;

    @Column(name = "pet_friendly", nullable = false)
    private boolean petFriendly;

    @Convert(converter = UnitStatusConverter.class)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private Status status = Status.AVAILABLE;

    @Column(name = "available_from")
    private LocalDate availableFrom;

    @Column(name = "image_url", columnDefinition = "text")
    private String imageUrl;

    @Column(name = "floorplan_url", columnDefinition = "text")
    private String floorplanUrl;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    /** Seed rows carry example.com placeholders; those are not sent to leads. */
    public boolean hasImage() {
        return imageUrl != null && !imageUrl.isBlank() && !imageUrl.trim().startsWith("https://example.com");
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        if (updatedAt == null) updatedAt = createdAt;
    }
}
