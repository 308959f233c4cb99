package com.example.availability.service.impl;

import com.example.availability.model.Court;
import com.example.availability.model.CourtPricing;
import com.example.availability.model.SpecialRate;
import com.example.availability.service.PricingService;
import com.example.availability.service.TimezoneService;
import com.example.availability.service.exception.InvalidTimeInputException;
import com.example.availability.service.exception.PricingException;
import com.example.availability.service.util.TimeInputs;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Hourly-rate pricing: weekend rate on Saturday and Sunday, peak rate 17:00-21:00 on weekdays,
 * base rate otherwise. Outside a weekend-rate day a matching special rate overrides base and peak.
 * The rate in force at the start time applies to the whole booking.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CourtRatePricingService implements PricingService {

    static final BigDecimal DEFAULT_HOURLY_RATE = BigDecimal.valueOf(30);
    static final BigDecimal MIN_PRICE = new BigDecimal("1.00");

    private static final int PEAK_START_HOUR = 17;
    private static final int PEAK_END_HOUR = 21;
    private static final BigDecimal MINUTES_PER_HOUR = BigDecimal.valueOf(60);

    private final TimezoneService timezoneService;

    @Override
    public BigDecimal calculatePrice(Court court, String startIso, String endIso, String userId) {
        if (court == null) {
            throw new PricingException("Court is required for pricing");
        }
        ZonedDateTime start = parse(startIso, "start");
        ZonedDateTime end = parse(endIso, "end");
        if (!end.isAfter(start)) {
            throw new InvalidTimeInputException("End time " + endIso + " is not after start time " + startIso);
        }

        BigDecimal rate = hourlyRate(court.getPricing(), start);
        if (rate.signum() < 0) {
            throw new PricingException("Negative hourly rate for court " + court.getId());
        }

        BigDecimal hours = BigDecimal.valueOf(Duration.between(start, end).toMinutes())
                .divide(MINUTES_PER_HOUR, 4, RoundingMode.HALF_UP);
        BigDecimal price = rate.multiply(hours).setScale(2, RoundingMode.HALF_UP).max(MIN_PRICE);

        log.debug("Price for court {} {} - {} (user {}): {}", court.getId(), startIso, endIso, userId, price);
        return price;
    }

    private ZonedDateTime parse(String iso, String which) {
        return TimeInputs.parseDateTime(iso, null, timezoneService.zoneId())
                .orElseThrow(() -> new InvalidTimeInputException("Invalid " + which + " time: " + iso));
    }

    private static BigDecimal hourlyRate(CourtPricing pricing, ZonedDateTime start) {
        BigDecimal base = pricing == null || pricing.getBaseHourlyRate() == null
                ? DEFAULT_HOURLY_RATE
                : pricing.getBaseHourlyRate();
        if (pricing == null) {
            return base;
        }

        DayOfWeek day = start.getDayOfWeek();
        boolean weekend = day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
        if (weekend && pricing.getWeekendRate() != null) {
            return pricing.getWeekendRate();
        }

        BigDecimal rate = base;
        int hour = start.getHour();
        if (!weekend && hour >= PEAK_START_HOUR && hour < PEAK_END_HOUR && pricing.getPeakHourRate() != null) {
            rate = pricing.getPeakHourRate();
        }
        return specialRate(pricing, day, start.toLocalTime()).orElse(rate);
    }

    private static Optional<BigDecimal> specialRate(CourtPricing pricing, DayOfWeek day, LocalTime time) {
        if (pricing.getSpecialRates() == null) {
            return Optional.empty();
        }
        return pricing.getSpecialRates().stream()
                .filter(special -> special.appliesAt(day, time))
                .findFirst()
                .map(SpecialRate::getRate);
    }
}
