package com.ai.leasing.matching;

import com.ai.leasing.entity.Unit;

import java.time.LocalDate;
import java.util.List;

/**
 * Ranked matches, or the reason there are none. {@code earliestAvailable} is set
 * only for {@link NoMatchReason#AVAILABILITY_DATE}.
 */
public record MatchResult(List<Unit> units, NoMatchReason reason, LocalDate earliestAvailable) {

    public MatchResult {
        units = units == null ? List.of() : List.copyOf(units);
    }

    public static MatchResult matched(List<Unit> units) {
        return new MatchResult(units, null, null);
    }

    public static MatchResult none(NoMatchReason reason, LocalDate earliestAvailable) {
        return new MatchResult(List.of(), reason, earliestAvailable);
    }

    public boolean hasMatches() {
        return !units.isEmpty();
    }

    public List<Unit> top(int limit) {
        return units.subList(0, Math.min(limit, units.size()));
    }
}
