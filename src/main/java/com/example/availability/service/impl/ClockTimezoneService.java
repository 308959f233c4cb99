package com.example.availability.service.impl;

import com.example.availability.service.TimezoneService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;

@Service
@RequiredArgsConstructor
public class ClockTimezoneService implements TimezoneService {

    private final Clock clock;

    @Override
    public String getUserTimezone() {
        return clock.getZone().getId();
    }

    @Override
    public ZoneId zoneId() {
        return clock.getZone();
    }

    @Override
    public ZonedDateTime now() {
        return ZonedDateTime.now(clock);
    }

    @Override
    public boolean isTimeSlotInPast(LocalDate date, int minutesSinceMidnight, int graceMinutes) {
        // wall-clock slot start, so DST transition days keep their labels
        ZonedDateTime bookableUntil = date.atStartOfDay()
                .plusMinutes(minutesSinceMidnight)
                .atZone(clock.getZone())
                .plusMinutes(graceMinutes);
        return now().isAfter(bookableUntil);
    }
}
