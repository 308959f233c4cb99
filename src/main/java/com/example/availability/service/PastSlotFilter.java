package com.example.availability.service;

import com.example.availability.config.AvailabilityConfig;
import com.example.availability.dto.TimeSlotOption;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * Marks elapsed slots unavailable on read-side views. The occupancy map is left alone, so
 * re-deriving a view later re-evaluates past-ness.
 */
@Component
@RequiredArgsConstructor
public class PastSlotFilter {

    private final TimezoneService timezoneService;
    private final AvailabilityConfig config;

    public List<TimeSlotOption> apply(LocalDate date, List<TimeSlotOption> options) {
        return options.stream()
                .map(option -> option.available() && isPast(date, option.value())
                        ? option.withAvailable(false)
                        : option)
                .toList();
    }

    public boolean isPast(LocalDate date, int minutesSinceMidnight) {
        return timezoneService.isTimeSlotInPast(date, minutesSinceMidnight, config.getPastGraceMinutes());
    }
}
