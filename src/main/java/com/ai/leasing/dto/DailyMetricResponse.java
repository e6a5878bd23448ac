package com.ai.leasing.dto;

import com.ai.leasing.entity.DailyMetric;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDate;

@Getter
@AllArgsConstructor
public class DailyMetricResponse {

    private final LocalDate date;
    private final int totalInquiries;
    private final int qualifiedLeads;
    private final int toursScheduled;
    private final int toursCompleted;
    private final BigDecimal conversionRateQualified;
    private final BigDecimal conversionRateTours;

    public static DailyMetricResponse of(DailyMetric m) {
        return new DailyMetricResponse(m.getDate(), m.getTotalInquiries(), m.getQualifiedLeads(),
                m.getToursScheduled(), m.getToursCompleted(), m.getConversionRateQualified(), m.getConversionRateTours());
    }
}
