package com.ai.leasing.conversation;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Matching preferences of a lead. Null means "not answered"; a field listed in
 * {@code skipped} was explicitly declined and counts as answered.
 */
public record LeadProfile(
        Integer rooms,
        BigDecimal budget,
        Boolean hasParking,
        String preferredArea,
        Integer preferredFloorMin,
        Integer preferredFloorMax,
        Boolean needsFurnished,
        Boolean petOwner,
        Set<ProfileField> skipped
) {

    public LeadProfile {
        skipped = skipped == null ? Set.of() : Set.copyOf(skipped);
    }

    public static LeadProfile empty() {
        return new LeadProfile(null, null, null, null, null, null, null, null, Set.of());
    }

    public boolean isSkipped(ProfileField field) {
        return skipped.contains(field);
    }

    public boolean requiresParking() {
        return Boolean.TRUE.equals(hasParking);
    }

    public boolean requiresFurnished() {
        return Boolean.TRUE.equals(needsFurnished);
    }

    public boolean requiresPetFriendly() {
        return Boolean.TRUE.equals(petOwner);
    }
}
