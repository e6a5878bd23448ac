package com.ai.leasing.matching;

import com.ai.leasing.entity.Property;
import com.ai.leasing.entity.Unit;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Filters and ranks a snapshot of units against a lead's criteria. Pure with respect
 * to the snapshot: the same snapshot, criteria and day always give the same order.
 */
@Component
public class UnitMatcher {

    private static final Logger log = LoggerFactory.getLogger(UnitMatcher.class);

    private final RoomsPolicy roomsPolicy;

    public UnitMatcher(@Value("${leasing.matching.rooms-policy:AT_LEAST}") RoomsPolicy roomsPolicy) {
        this.roomsPolicy = roomsPolicy;
    }

    /**
     * @param today units without an availability date count as available from this day
     */
    public MatchResult match(MatchCriteria criteria, List<Unit> snapshot, LocalDate today) {
        List<Unit> available = snapshot.stream()
                .filter(u -> u.getStatus() == Unit.Status.AVAILABLE)
                .collect(Collectors.toList());
        if (available.isEmpty()) {
            return MatchResult.none(NoMatchReason.NO_INVENTORY, null);
        }

        List<Unit> ranked = filter(criteria, available).stream()
                .sorted(ranking(criteria.budget(), today))
                .collect(Collectors.toList());
        if (!ranked.isEmpty()) {
            log.debug("Matched {} of {} available units", ranked.size(), available.size());
            return MatchResult.matched(ranked);
        }

        if (criteria.moveInDate() != null) {
            List<Unit> later = filter(criteria.withoutMoveInDate(), available);
            if (!later.isEmpty()) {
                LocalDate earliest = later.stream()
                        .map(Unit::getAvailableFrom)
                        .filter(Objects::nonNull)
                        .min(Comparator.naturalOrder())
                        .orElse(null);
                return MatchResult.none(NoMatchReason.AVAILABILITY_DATE, earliest);
            }
        }
        if (criteria.budget() != null && !filter(criteria.withoutBudget(), available).isEmpty()) {
            return MatchResult.none(NoMatchReason.BUDGET, null);
        }
        return MatchResult.none(NoMatchReason.OTHER_CONSTRAINTS, null);
    }

    boolean accepts(MatchCriteria c, Unit unit) {
        if (unit.getStatus() != Unit.Status.AVAILABLE) return false;
        if (c.rooms() != null && (unit.getRooms() == null || !roomsPolicy.accepts(unit.getRooms(), c.rooms()))) {
            return false;
        }
        if (c.budget() != null && unit.getPrice().compareTo(c.budget()) > 0) return false;
        if (c.requiresParking() && !unit.isHasParking()) return false;
        if (c.requiresFurnished() && !unit.isFurnished()) return false;
        if (c.requiresPetFriendly() && !unit.isPetFriendly()) return false;
        if (c.floorMin() != null && c.floorMax() != null) {
            if (unit.getFloor() == null || unit.getFloor() < c.floorMin() || unit.getFloor() > c.floorMax()) {
                return false;
            }
        }
        if (c.moveInDate() != null && unit.getAvailableFrom() != null
                && unit.getAvailableFrom().isAfter(c.moveInDate())) {
            return false;
        }
        return StringUtils.isBlank(c.preferredArea()) || inArea(unit.getProperty(), c.preferredArea());
    }

    private List<Unit> filter(MatchCriteria criteria, List<Unit> units) {
        return units.stream().filter(u -> accepts(criteria, u)).collect(Collectors.toList());
    }

    private static Comparator<Unit> ranking(BigDecimal budget, LocalDate today) {
        Comparator<Unit> byPriceDistance = Comparator.comparing(
                (Unit u) -> budget == null ? BigDecimal.ZERO : u.getPrice().subtract(budget).abs());
        return byPriceDistance
                .thenComparing((Unit u) -> u.getAvailableFrom() != null ? u.getAvailableFrom() : today)
                .thenComparing(Unit::getId, Comparator.nullsLast(Comparator.naturalOrder()));
    }

    private static boolean inArea(Property property, String area) {
        if (property == null) return false;
        String wanted = normalize(area);
        return normalize(property.getName()).contains(wanted) || normalize(property.getAddress()).contains(wanted);
    }

    private static String normalize(String text) {
        if (text == null) return "";
        return StringUtils.deleteWhitespace(StringUtils.stripAccents(text)).toLowerCase(Locale.ROOT)
                .replaceAll("[\\p{Punct}]", "");
    }
}
