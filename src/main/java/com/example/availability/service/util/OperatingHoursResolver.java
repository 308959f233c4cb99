package com.example.availability.service.util;

import com.example.availability.dto.OperatingWindow;
import com.example.availability.model.OpeningHours;
import com.example.availability.model.Venue;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Map;
import java.util.Optional;

public final class OperatingHoursResolver {

    private OperatingHoursResolver() {
    }

    /**
     * Window for the weekday of {@code date}; empty when the venue is closed that day.
     */
    public static Optional<OperatingWindow> windowFor(Venue venue, LocalDate date, OperatingWindow defaults) {
        Map<DayOfWeek, OpeningHours> hours = venue == null ? null : venue.getOperatingHours();
        if (hours == null || hours.isEmpty()) {
            return Optional.of(defaults);
        }

        OpeningHours today = hours.get(date.getDayOfWeek());
        if (today == null || today.open() == null || today.close() == null) {
            return Optional.empty();
        }

        int open = toMinutes(today.open());
        int close = LocalTime.MIDNIGHT.equals(today.close()) ? TimeInputs.END_OF_DAY : toMinutes(today.close());
        OperatingWindow window = new OperatingWindow(open, close);
        return window.isEmpty() ? Optional.empty() : Optional.of(window);
    }

    private static int toMinutes(LocalTime time) {
        return time.getHour() * 60 + time.getMinute();
    }
}
