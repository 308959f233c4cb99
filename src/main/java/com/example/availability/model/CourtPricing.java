package com.example.availability.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class CourtPricing {

    private BigDecimal baseHourlyRate;

    /** Weekdays 17:00-21:00 */
    private BigDecimal peakHourRate;

    /** Saturday and Sunday, all day */
    private BigDecimal weekendRate;

    /** First match wins; not consulted when the weekend rate applies */
    @Builder.Default
    private List<SpecialRate> specialRates = List.of();
}
