package com.ai.leasing.entity;

import com.ai.leasing.conversation.LeadProfile;
import com.ai.leasing.conversation.LeadStage;
import com.ai.leasing.conversation.ProfileField;
import com.ai.leasing.conversation.QualificationState;
import com.ai.leasing.entity.converter.LeadStageConverter;
import jakarta.persistence.*;
import lombok.*;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

@Entity
@Table(name = "leads", indexes = {
    @Index(name = "idx_leads_stage", columnList = "stage"),
    @Index(name = "idx_leads_last_interaction", columnList = "last_interaction"),
    @Index(name = "idx_leads_created_at", columnList = "created_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Lead {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "phone_number", nullable = false, unique = true, length = 20)
    private String phoneNumber;

    /** Channel display name; the phone number until the channel reports one. */
    @Column(nullable = false)
    private String name;

    private String email;

    @Convert(converter = LeadStageConverter.class)
    @Column(nullable = false, length = 50)
    @Builder.Default
    private LeadStage stage = LeadStage.NEW;

    // Gate answers
    @Column(name = "has_payslips")
    private Boolean hasPayslips;

    @Column(name = "can_pay_deposit")
    private Boolean canPayDeposit;

    @Column(name = "move_in_date")
    private LocalDate moveInDate;

    // Profile
    private Integer rooms;

    @Column(precision = 10, scale = 2)
    private BigDecimal budget;

    @Column(name = "has_parking")
    private Boolean hasParking;

    @Column(name = "preferred_area", columnDefinition = "text")
    private String preferredArea;

    @Column(name = "preferred_floor_min")
    private Integer preferredFloorMin;

    @Column(name = "preferred_floor_max")
    private Integer preferredFloorMax;

    @Column(name = "needs_furnished")
    private Boolean needsFurnished;

    @Column(name = "pet_owner")
    private Boolean petOwner;

    /** Comma separated {@link ProfileField} names the lead chose not to answer. */
    @Column(name = "skipped_profile_fields")
    private String skippedProfileFields;

    @Column(length = 100)
    @Builder.Default
    private String source = "whatsapp";

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "last_interaction")
    private Instant lastInteraction;

    @Column(name = "qualified_at")
    private Instant qualifiedAt;

    @Version
    private Long version;

    public QualificationState toState() {
        LeadProfile profile = new LeadProfile(
                rooms, budget, hasParking, preferredArea,
                preferredFloorMin, preferredFloorMax, needsFurnished, petOwner,
                parseSkipped(skippedProfileFields));
        return new QualificationState(stage, hasPayslips, canPayDeposit, moveInDate, profile);
    }

    /**
     * Copies an accepted state back onto the entity and stamps the interaction time.
     */
    public void applyState(QualificationState state, Instant now) {
        if (state.stage() == LeadStage.QUALIFIED && stage != LeadStage.QUALIFIED && qualifiedAt == null) {
            qualifiedAt = now;
        }
        stage = state.stage();
        hasPayslips = state.hasPayslips();
        canPayDeposit = state.canPayDeposit();
        moveInDate = state.moveInDate();
        LeadProfile p = state.profile();
        rooms = p.rooms();
        budget = p.budget();
        hasParking = p.hasParking();
        preferredArea = p.preferredArea();
        preferredFloorMin = p.preferredFloorMin();
        preferredFloorMax = p.preferredFloorMax();
        needsFurnished = p.needsFurnished();
        petOwner = p.petOwner();
        skippedProfileFields = p.skipped().isEmpty()
                ? null
                : p.skipped().stream().sorted().map(Enum::name).collect(Collectors.joining(","));
        touch(now);
    }

    public void touch(Instant now) {
        updatedAt = now;
        lastInteraction = now;
    }

    private static Set<ProfileField> parseSkipped(String raw) {
        if (StringUtils.isBlank(raw)) return Set.of();
        EnumSet<ProfileField> fields = EnumSet.noneOf(ProfileField.class);
        Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(StringUtils::isNotEmpty)
                .forEach(name -> fields.add(ProfileField.valueOf(name)));
        return fields;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        if (updatedAt == null) updatedAt = createdAt;
        if (lastInteraction == null) lastInteraction = createdAt;
    }
}
