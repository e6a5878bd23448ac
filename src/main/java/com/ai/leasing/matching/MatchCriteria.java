package com.ai.leasing.matching;

import com.ai.leasing.conversation.LeadProfile;
import com.ai.leasing.conversation.QualificationState;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * What a lead asks of a unit. Null values impose no constraint.
 */
public record MatchCriteria(
        Integer rooms,
        BigDecimal budget,
        boolean requiresParking,
        String preferredArea,
        Integer floorMin,
        Integer floorMax,
        boolean requiresFurnished,
        boolean requiresPetFriendly,
        LocalDate moveInDate
) {

    public static MatchCriteria from(QualificationState state) {
        LeadProfile p = state.profile();
        return new MatchCriteria(
                p.rooms(),
                p.budget(),
                p.requiresParking(),
                p.preferredArea(),
                p.preferredFloorMin(),
                p.preferredFloorMax(),
                p.requiresFurnished(),
                p.requiresPetFriendly(),
                state.moveInDate());
    }

    public MatchCriteria withoutMoveInDate() {
        return new MatchCriteria(rooms, budget, requiresParking, preferredArea, floorMin, floorMax,
                requiresFurnished, requiresPetFriendly, null);
    }

    public MatchCriteria withoutBudget() {
        return new MatchCriteria(rooms, null, requiresParking, preferredArea, floorMin, floorMax,
                requiresFurnished, requiresPetFriendly, moveInDate);
    }
}
