package com.example.availability.service.impl;

import com.example.availability.model.Court;
import com.example.availability.model.CourtPricing;
import com.example.availability.model.SpecialRate;
import com.example.availability.service.exception.InvalidTimeInputException;
import com.example.availability.service.exception.PricingException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.List;
import java.util.Set;

import static com.example.availability.Fixtures.DAY;
import static com.example.availability.Fixtures.clockAt;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CourtRatePricingServiceTest {

    private final CourtRatePricingService pricing =
            new CourtRatePricingService(new ClockTimezoneService(clockAt(DAY, "08:00")));

    private final Court court = Court.builder()
            .id("Court-1")
            .pricing(CourtPricing.builder()
                    .baseHourlyRate(new BigDecimal("30"))
                    .peakHourRate(new BigDecimal("45"))
                    .weekendRate(new BigDecimal("40"))
                    .build())
            .build();

    @Test
    void weekdayMorningUsesBaseRate() {
        assertThat(pricing.calculatePrice(court, "2026-10-16T10:00:00+02:00", "2026-10-16T11:00:00+02:00", null))
                .isEqualByComparingTo("30.00");
    }

    @Test
    void weekdayEveningUsesPeakRate() {
        assertThat(pricing.calculatePrice(court, "2026-10-16T18:00:00+02:00", "2026-10-16T19:30:00+02:00", "u1"))
                .isEqualByComparingTo("67.50");
    }

    @Test
    void weekendUsesWeekendRate() {
        assertThat(pricing.calculatePrice(court, "2026-10-17T18:00:00+02:00", "2026-10-17T19:30:00+02:00", null))
                .isEqualByComparingTo("60.00");
    }

    @Test
    void specialRateOverridesPeakInsideItsWindow() {
        Court happyHour = withSpecials(SpecialRate.builder()
                .name("Friday happy hour")
                .rate(new BigDecimal("20"))
                .applyDays(Set.of(DayOfWeek.FRIDAY))
                .startTime(LocalTime.of(17, 0))
                .endTime(LocalTime.of(19, 0))
                .build());

        assertThat(pricing.calculatePrice(happyHour, "2026-10-16T18:00:00+02:00", "2026-10-16T19:00:00+02:00", null))
                .isEqualByComparingTo("20.00");
        assertThat(pricing.calculatePrice(happyHour, "2026-10-16T19:00:00+02:00", "2026-10-16T20:00:00+02:00", null))
                .isEqualByComparingTo("45.00");
        assertThat(pricing.calculatePrice(happyHour, "2026-10-15T18:00:00+02:00", "2026-10-15T19:00:00+02:00", null))
                .isEqualByComparingTo("45.00");
    }

    @Test
    void firstMatchingSpecialRateWins() {
        Court twoSpecials = withSpecials(
                SpecialRate.builder().name("all day").rate(new BigDecimal("22")).build(),
                SpecialRate.builder().name("mornings").rate(new BigDecimal("18"))
                        .startTime(LocalTime.of(8, 0)).endTime(LocalTime.of(12, 0)).build());

        assertThat(pricing.calculatePrice(twoSpecials, "2026-10-16T10:00:00+02:00", "2026-10-16T11:00:00+02:00", null))
                .isEqualByComparingTo("22.00");
    }

    @Test
    void weekendRateTakesPrecedenceOverSpecials() {
        SpecialRate sunday = SpecialRate.builder().name("sunday").rate(new BigDecimal("25"))
                .applyDays(Set.of(DayOfWeek.SUNDAY)).build();
        Court withWeekendRate = withSpecials(sunday);
        Court withoutWeekendRate = Court.builder()
                .id("Court-3")
                .pricing(CourtPricing.builder()
                        .baseHourlyRate(new BigDecimal("30"))
                        .specialRates(List.of(sunday))
                        .build())
                .build();

        assertThat(pricing.calculatePrice(withWeekendRate, "2026-10-18T10:00:00+02:00", "2026-10-18T11:00:00+02:00", null))
                .isEqualByComparingTo("40.00");
        assertThat(pricing.calculatePrice(withoutWeekendRate, "2026-10-18T10:00:00+02:00", "2026-10-18T11:00:00+02:00", null))
                .isEqualByComparingTo("25.00");
    }

    @Test
    void courtWithoutPricingUsesDefaultRate() {
        Court plain = Court.builder().id("Court-2").build();

        assertThat(pricing.calculatePrice(plain, "2026-10-16T10:00:00", "2026-10-16T10:30:00", null))
                .isEqualByComparingTo("15.00");
    }

    @Test
    void roundsHalfUpWithFloor() {
        Court odd = Court.builder().id("c").pricing(CourtPricing.builder().baseHourlyRate(new BigDecimal("25.55")).build()).build();
        Court cheap = Court.builder().id("c").pricing(CourtPricing.builder().baseHourlyRate(new BigDecimal("0.50")).build()).build();

        assertThat(pricing.calculatePrice(odd, "2026-10-16T10:00:00", "2026-10-16T11:30:00", null))
                .isEqualByComparingTo("38.33");
        assertThat(pricing.calculatePrice(cheap, "2026-10-16T10:00:00", "2026-10-16T10:30:00", null))
                .isEqualByComparingTo("1.00");
    }

    private Court withSpecials(SpecialRate... specials) {
        return court.toBuilder()
                .pricing(court.getPricing().toBuilder().specialRates(List.of(specials)).build())
                .build();
    }

    @Test
    void rejectsBadInput() {
        assertThatThrownBy(() -> pricing.calculatePrice(court, "2026-10-16T11:00:00", "2026-10-16T10:00:00", null))
                .isInstanceOf(InvalidTimeInputException.class);
        assertThatThrownBy(() -> pricing.calculatePrice(court, "10:00", "2026-10-16T10:00:00", null))
                .isInstanceOf(InvalidTimeInputException.class)
                .hasMessageContaining("start");
        assertThatThrownBy(() -> pricing.calculatePrice(null, "2026-10-16T10:00:00", "2026-10-16T11:00:00", null))
                .isInstanceOf(PricingException.class);
    }
}
