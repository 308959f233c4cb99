package com.example.availability.service;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Venue-local notion of "now". All past-ness checks go through here, never through server time.
 */
public interface TimezoneService {

    /** IANA identifier, e.g. "Europe/Berlin" */
    String getUserTimezone();

    ZoneId zoneId();

    ZonedDateTime now();

    /**
     * True when {@code now > slotStart + graceMinutes}, the slot start being {@code minutesSinceMidnight}
     * on {@code date} in the user's zone.
     */
    boolean isTimeSlotInPast(LocalDate date, int minutesSinceMidnight, int graceMinutes);
}
