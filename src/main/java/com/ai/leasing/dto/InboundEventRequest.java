package com.ai.leasing.dto;

import com.ai.leasing.conversation.LeadEvent;
import com.ai.leasing.conversation.LeadProfile;
import com.ai.leasing.conversation.ProfileField;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;

/**
 * A pre-classified inbound message. {@code type} picks which of the other fields is read.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class InboundEventRequest {

    public enum Type {
        CONTACT,
        PAYSLIPS,
        DEPOSIT,
        MOVE_IN_DATE,
        PROFILE
    }

    private Type type;

    /** Transport message id; repeats are acknowledged without being applied again. */
    private String messageId;

    private String name;

    /** Original text of the message, kept in the conversation log. */
    private String text;

    /** Yes/no answer for the payslips and deposit gates. */
    private Boolean answer;

    private LocalDate moveInDate;

    private Profile profile;

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Profile {
        private Integer rooms;
        private BigDecimal budget;
        private Boolean hasParking;
        private String preferredArea;
        private Integer preferredFloorMin;
        private Integer preferredFloorMax;
        private Boolean needsFurnished;
        private Boolean petOwner;
        private List<ProfileField> skipped;
    }

    /**
     * @throws IllegalArgumentException when the fields required by {@code type} are missing
     */
    public LeadEvent toEvent() {
        if (type == null) {
            throw new IllegalArgumentException("type is required");
        }
        switch (type) {
            case CONTACT:
                return new LeadEvent.ContactStarted();
            case PAYSLIPS:
                return new LeadEvent.PayslipsAnswered(requireAnswer());
            case DEPOSIT:
                return new LeadEvent.DepositAnswered(requireAnswer());
            case MOVE_IN_DATE:
                if (moveInDate == null) throw new IllegalArgumentException("moveInDate is required");
                return new LeadEvent.MoveInDateAnswered(moveInDate);
            case PROFILE:
                if (profile == null) throw new IllegalArgumentException("profile is required");
                EnumSet<ProfileField> skipped = EnumSet.noneOf(ProfileField.class);
                if (profile.getSkipped() != null) skipped.addAll(profile.getSkipped());
                return new LeadEvent.ProfileProvided(new LeadProfile(
                        profile.getRooms(), profile.getBudget(), profile.getHasParking(),
                        profile.getPreferredArea(), profile.getPreferredFloorMin(), profile.getPreferredFloorMax(),
                        profile.getNeedsFurnished(), profile.getPetOwner(), skipped));
            default:
                throw new IllegalArgumentException("Unsupported type " + type);
        }
    }

    private boolean requireAnswer() {
        if (answer == null) throw new IllegalArgumentException("answer is required for " + type);
        return answer;
    }
}
