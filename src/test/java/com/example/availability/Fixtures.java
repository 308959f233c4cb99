package com.example.availability;

import com.example.availability.config.AvailabilityConfig;
import com.example.availability.model.Booking;
import com.example.availability.model.Court;
import com.example.availability.model.CourtStatus;
import com.example.availability.model.Venue;
import com.example.availability.repository.BookingStore;
import com.example.availability.repository.CourtRegistry;
import com.example.availability.repository.VenueRegistry;
import com.example.availability.service.AvailabilityEngine;
import com.example.availability.service.FlowResolver;
import com.example.availability.service.PastSlotFilter;
import com.example.availability.service.TimezoneService;
import com.example.availability.service.impl.ClockTimezoneService;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;

public final class Fixtures {

    public static final ZoneId ZONE = ZoneId.of("Europe/Berlin");
    public static final LocalDate DAY = LocalDate.of(2026, 10, 16); // Friday
    public static final String VENUE_ID = "venue-1";

    private Fixtures() {
    }

    public static Clock clockAt(LocalDate date, String time) {
        return Clock.fixed(LocalDateTime.of(date, LocalTime.parse(time)).atZone(ZONE).toInstant(), ZONE);
    }

    public static Venue venue() {
        return Venue.builder().id(VENUE_ID).name("Riverside Tennis").build();
    }

    public static Court court(String id, String name) {
        return Court.builder().id(id).name(name).venueId(VENUE_ID).status(CourtStatus.ACTIVE).build();
    }

    /** Confirmed booking on {@link #DAY}, times as HH:mm local. */
    public static Booking booking(String id, String courtId, String start, String end) {
        return Booking.builder()
                .id(id)
                .courtId(courtId)
                .venueId(VENUE_ID)
                .date(DAY)
                .startTime(DAY + "T" + start + ":00")
                .endTime(DAY + "T" + end + ":00")
                .status(Booking.BookingStatus.CONFIRMED)
                .build();
    }

    public static AvailabilityEngine engine(CourtRegistry courts, VenueRegistry venues, BookingStore bookings, Clock clock) {
        AvailabilityConfig config = new AvailabilityConfig();
        TimezoneService timezoneService = new ClockTimezoneService(clock);
        return new AvailabilityEngine(courts, venues, bookings, new FlowResolver(),
                new PastSlotFilter(timezoneService, config), timezoneService, config);
    }
}
