package com.ai.leasing.dto;

import com.ai.leasing.entity.Unit;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDate;

@Getter
@AllArgsConstructor
public class UnitSummary {

    private final Long id;
    private final String unitNumber;
    private final String propertyName;
    private final Integer rooms;
    private final BigDecimal price;
    private final LocalDate availableFrom;
    /** Photo the channel adapter sends along with the recommendation; null when the unit has none. */
    private final String imageUrl;

    public static UnitSummary of(Unit unit) {
        return new UnitSummary(unit.getId(), unit.getUnitNumber(),
                unit.getProperty() != null ? unit.getProperty().getName() : null,
                unit.getRooms(), unit.getPrice(), unit.getAvailableFrom(),
                unit.hasImage() ? unit.getImageUrl().trim() : null);
    }
}
