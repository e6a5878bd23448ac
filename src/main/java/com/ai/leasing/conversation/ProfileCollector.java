package com.ai.leasing.conversation;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Accumulates the matching profile across messages. Pure: never touches storage.
 */
@Component
public class ProfileCollector {

    public static final int MIN_ROOMS = 1;
    public static final int MAX_ROOMS = 10;

    /**
     * Overlays the non-null values of {@code update} on {@code current}. A value
     * supplied for a previously skipped field clears the skip.
     *
     * @throws IllegalArgumentException when a value is out of range or a field is
     *                                  both supplied and skipped
     */
    public LeadProfile merge(LeadProfile current, LeadProfile update) {
        if (update == null) return current;
        validate(update);

        Integer rooms = pick(update.rooms(), current.rooms());
        BigDecimal budget = pick(update.budget(), current.budget());
        Boolean parking = pick(update.hasParking(), current.hasParking());
        String area = StringUtils.isNotBlank(update.preferredArea())
                ? update.preferredArea().trim()
                : current.preferredArea();
        Integer floorMin = pick(update.preferredFloorMin(), current.preferredFloorMin());
        Integer floorMax = pick(update.preferredFloorMax(), current.preferredFloorMax());
        Boolean furnished = pick(update.needsFurnished(), current.needsFurnished());
        Boolean pets = pick(update.petOwner(), current.petOwner());

        if (floorMin != null && floorMax != null && floorMin > floorMax) {
            throw new IllegalArgumentException("Floor range is inverted: " + floorMin + " > " + floorMax);
        }

        EnumSet<ProfileField> skipped = EnumSet.noneOf(ProfileField.class);
        skipped.addAll(current.skipped());
        skipped.addAll(update.skipped());
        skipped.removeAll(supplied(update));

        return new LeadProfile(rooms, budget, parking, area, floorMin, floorMax, furnished, pets, skipped);
    }

    /** Fields still unanswered, in the order they are asked. */
    public List<ProfileField> missingFields(LeadProfile profile) {
        List<ProfileField> missing = new ArrayList<>();
        for (ProfileField field : ProfileField.values()) {
            if (!isAnswered(profile, field)) {
                missing.add(field);
            }
        }
        return missing;
    }

    public Optional<ProfileField> nextField(LeadProfile profile) {
        return missingFields(profile).stream().findFirst();
    }

    public boolean isComplete(LeadProfile profile) {
        return missingFields(profile).isEmpty();
    }

    boolean isAnswered(LeadProfile profile, ProfileField field) {
        if (profile.isSkipped(field)) return true;
        switch (field) {
            case ROOMS: return profile.rooms() != null;
            case BUDGET: return profile.budget() != null;
            case HAS_PARKING: return profile.hasParking() != null;
            case PREFERRED_AREA: return StringUtils.isNotBlank(profile.preferredArea());
            case FLOOR_RANGE: return profile.preferredFloorMin() != null || profile.preferredFloorMax() != null;
            case NEEDS_FURNISHED: return profile.needsFurnished() != null;
            case PET_OWNER: return profile.petOwner() != null;
            default: return false;
        }
    }

    private void validate(LeadProfile update) {
        if (update.rooms() != null && (update.rooms() < MIN_ROOMS || update.rooms() > MAX_ROOMS)) {
            throw new IllegalArgumentException("Rooms must be between " + MIN_ROOMS + " and " + MAX_ROOMS);
        }
        if (update.budget() != null && update.budget().signum() <= 0) {
            throw new IllegalArgumentException("Budget must be positive");
        }
        Set<ProfileField> both = EnumSet.noneOf(ProfileField.class);
        both.addAll(supplied(update));
        both.retainAll(update.skipped());
        if (!both.isEmpty()) {
            throw new IllegalArgumentException("Fields both supplied and skipped: " + both);
        }
    }

    private Set<ProfileField> supplied(LeadProfile update) {
        Set<ProfileField> fields = EnumSet.noneOf(ProfileField.class);
        LeadProfile withoutSkips = new LeadProfile(update.rooms(), update.budget(), update.hasParking(),
                update.preferredArea(), update.preferredFloorMin(), update.preferredFloorMax(),
                update.needsFurnished(), update.petOwner(), Set.of());
        for (ProfileField field : ProfileField.values()) {
            if (isAnswered(withoutSkips, field)) {
                fields.add(field);
            }
        }
        return fields;
    }

    private static <T> T pick(T update, T current) {
        return update != null ? update : current;
    }
}
