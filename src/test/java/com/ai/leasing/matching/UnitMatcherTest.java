package com.ai.leasing.matching;

import com.ai.leasing.entity.Property;
import com.ai.leasing.entity.Unit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class UnitMatcherTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 3, 10);

    private final UnitMatcher matcher = new UnitMatcher(RoomsPolicy.AT_LEAST);

    private Property residence;
    private List<Unit> units;

    @BeforeEach
    void setUp() {
        residence = Property.builder().id(1L).name("Sample Residence").address("12 Herzl St, Tel Aviv").build();
        units = new ArrayList<>();
        units.add(unit(1L, "A1", 3, "7500", TODAY, 2, true));
        units.add(unit(2L, "A2", 4, "9200", TODAY.plusWeeks(1), 3, true));
        units.add(unit(3L, "B1", 2, "6200", TODAY, 1, false));
        units.add(unit(4L, "B2", 3, "8100", TODAY.plusWeeks(2), 4, false));
    }

    @Test
    void budgetBelowEveryUnitIsBudgetNoFit() {
        MatchResult result = matcher.match(criteria(2, "6000", null), units, TODAY);

        assertThat(result.hasMatches()).isFalse();
        assertThat(result.reason()).isEqualTo(NoMatchReason.BUDGET);
        assertThat(result.reason().outcome().code()).isEqualTo("no_fit");
    }

    @Test
    void cheapestFittingUnitIsReturned() {
        MatchResult result = matcher.match(criteria(2, "6500", null), units, TODAY);

        assertThat(result.units()).extracting(Unit::getUnitNumber).containsExactly("B1");
    }

    @Test
    void rankedByDistanceFromBudget() {
        MatchResult result = matcher.match(criteria(2, "9000", null), units, TODAY);

        assertThat(result.units()).extracting(Unit::getUnitNumber).containsExactly("B2", "A1", "B1");
        assertThat(result.top(2)).extracting(Unit::getUnitNumber).containsExactly("B2", "A1");
    }

    @Test
    void orderDoesNotDependOnSnapshotOrder() {
        List<Unit> shuffled = new ArrayList<>(units);
        Collections.reverse(shuffled);
        units.add(unit(5L, "C1", 3, "7500", TODAY, 2, true));
        shuffled.add(0, units.get(4));

        assertThat(matcher.match(criteria(3, "7500", null), units, TODAY).units())
                .extracting(Unit::getId)
                .containsExactlyElementsOf(
                        matcher.match(criteria(3, "7500", null), shuffled, TODAY).units().stream().map(Unit::getId).collect(Collectors.toList()));
    }

    @Test
    void tieBrokenByAvailabilityThenId() {
        units.add(unit(6L, "C2", 3, "7500", TODAY.minusDays(3), 2, true));
        units.add(unit(7L, "C3", 3, "7500", TODAY, 2, true));

        MatchResult result = matcher.match(criteria(3, "7500", null), units, TODAY);

        assertThat(result.units()).extracting(Unit::getId).startsWith(6L, 1L, 7L);
    }

    @Test
    void unitWithoutDateRanksAsAvailableToday() {
        units.add(unit(8L, "C4", 3, "7500", null, 2, true));
        units.add(unit(9L, "C5", 3, "7500", TODAY.minusDays(1), 2, true));
        units.add(unit(10L, "C6", 3, "7500", TODAY.plusDays(1), 2, true));

        MatchResult result = matcher.match(criteria(3, "7500", null), units, TODAY);

        assertThat(result.units()).extracting(Unit::getId).startsWith(9L, 1L, 8L, 10L);
    }

    @Test
    void lateAvailabilityIsFutureFitWithEarliestDate() {
        MatchCriteria c = new MatchCriteria(4, null, false, null, null, null, false, false, TODAY.plusDays(2));

        MatchResult result = matcher.match(c, units, TODAY);

        assertThat(result.reason()).isEqualTo(NoMatchReason.AVAILABILITY_DATE);
        assertThat(result.earliestAvailable()).isEqualTo(TODAY.plusWeeks(1));
        assertThat(result.reason().outcome().code()).isEqualTo("future_fit");
    }

    @Test
    void parkingRequirementFilters() {
        MatchCriteria c = new MatchCriteria(2, new BigDecimal("8500"), true, null, null, null, false, false, null);

        assertThat(matcher.match(c, units, TODAY).units()).extracting(Unit::getUnitNumber).containsExactly("A1");
    }

    @Test
    void unmetFeatureIsOtherConstraints() {
        MatchCriteria c = new MatchCriteria(2, new BigDecimal("10000"), false, null, null, null, true, false, null);

        assertThat(matcher.match(c, units, TODAY).reason()).isEqualTo(NoMatchReason.OTHER_CONSTRAINTS);
    }

    @Test
    void exactRoomsPolicy() {
        UnitMatcher exact = new UnitMatcher(RoomsPolicy.EXACT);

        assertThat(exact.match(criteria(2, "9000", null), units, TODAY).units())
                .extracting(Unit::getUnitNumber).containsExactly("B1");
    }

    @Test
    void areaMatchesPropertyNameOrAddressLoosely() {
        MatchCriteria byAddress = new MatchCriteria(2, null, false, "tel-aviv", null, null, false, false, null);
        MatchCriteria elsewhere = new MatchCriteria(2, null, false, "Haifa", null, null, false, false, null);

        assertThat(matcher.match(byAddress, units, TODAY).units()).hasSize(4);
        assertThat(matcher.match(elsewhere, units, TODAY).reason()).isEqualTo(NoMatchReason.OTHER_CONSTRAINTS);
    }

    @Test
    void floorRangeApplied() {
        MatchCriteria c = new MatchCriteria(null, null, false, null, 2, 3, false, false, null);

        assertThat(matcher.match(c, units, TODAY).units()).extracting(Unit::getUnitNumber).containsExactlyInAnyOrder("A1", "A2");
    }

    @Test
    void nonAvailableUnitsAreIgnored() {
        units.forEach(u -> u.setStatus(Unit.Status.RENTED));

        MatchResult result = matcher.match(criteria(2, "9000", null), units, TODAY);

        assertThat(result.reason()).isEqualTo(NoMatchReason.NO_INVENTORY);
    }

    private static MatchCriteria criteria(Integer rooms, String budget, LocalDate moveIn) {
        return new MatchCriteria(rooms, budget == null ? null : new BigDecimal(budget),
                false, null, null, null, false, false, moveIn);
    }

    private Unit unit(Long id, String number, int rooms, String price, LocalDate from, int floor, boolean parking) {
        return Unit.builder()
                .id(id)
                .property(residence)
                .unitNumber(number)
                .rooms(rooms)
                .price(new BigDecimal(price))
                .availableFrom(from)
                .floor(floor)
                .hasParking(parking)
                .build();
    }
}
