package com.example.availability.service.util;

import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * Parsing and formatting of the time values that cross the engine boundary.
 * Every parse returns an {@link Optional}; callers decide what an empty result means.
 */
@Slf4j
public final class TimeInputs {

    public static final int SLOT_MINUTES = 30;
    public static final int END_OF_DAY = 24 * 60;

    private TimeInputs() {
    }

    /** 510 -> "08:30" */
    public static String label(int minutes) {
        return String.format("%02d:%02d", minutes / 60, minutes % 60);
    }

    /**
     * Accepts an ISO date-time with offset or zone, an ISO local date-time (read in {@code zone}),
     * or a bare HH:mm that is placed on {@code fallbackDate}. Result is expressed in {@code zone}.
     */
    public static Optional<ZonedDateTime> parseDateTime(String raw, LocalDate fallbackDate, ZoneId zone) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim();
        try {
            if (value.indexOf('T') > 0) {
                TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                        .parseBest(value, ZonedDateTime::from, LocalDateTime::from);
                if (parsed instanceof ZonedDateTime zoned) {
                    return Optional.of(zoned.withZoneSameInstant(zone));
                }
                return Optional.of(((LocalDateTime) parsed).atZone(zone));
            }
            if (fallbackDate == null) {
                return Optional.empty();
            }
            return Optional.of(LocalTime.parse(value).atDate(fallbackDate).atZone(zone));
        } catch (DateTimeParseException e) {
            log.debug("Unparseable date-time '{}': {}", raw, e.getMessage());
            return Optional.empty();
        }
    }

    /** Minutes since midnight of {@code date}, clamped to [0, 1440] for instants on other days. */
    public static int minutesOnDate(ZonedDateTime dateTime, LocalDate date) {
        LocalDate local = dateTime.toLocalDate();
        if (local.isBefore(date)) {
            return 0;
        }
        if (local.isAfter(date)) {
            return END_OF_DAY;
        }
        return dateTime.getHour() * 60 + dateTime.getMinute();
    }

    /** Start minute of every 30-minute sub-slot in {@code [start, start + duration)}. */
    public static List<Integer> subSlots(int startMinutes, int durationMinutes) {
        return IntStream.iterate(startMinutes, m -> m < startMinutes + durationMinutes, m -> m + SLOT_MINUTES)
                .boxed()
                .toList();
    }

    public static int alignUp(int minutes) {
        int remainder = minutes % SLOT_MINUTES;
        return remainder == 0 ? minutes : minutes + SLOT_MINUTES - remainder;
    }

    public static int alignDown(int minutes) {
        return minutes - minutes % SLOT_MINUTES;
    }
}
