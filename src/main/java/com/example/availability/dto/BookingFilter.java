package com.example.availability.dto;

import com.example.availability.model.Booking;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Set;

public record BookingFilter(LocalDate date, String venueId, Set<Booking.BookingStatus> statusIn) {

    public BookingFilter {
        statusIn = Set.copyOf(statusIn);
    }

    public static BookingFilter active(LocalDate date, String venueId) {
        return new BookingFilter(date, venueId, Booking.BookingStatus.ACTIVE);
    }

    /** Bookings without a date pass; they are placed on the day by their start and end times. */
    public boolean matches(Booking booking) {
        return booking != null
                && (booking.getDate() == null || Objects.equals(date, booking.getDate()))
                && (venueId == null || booking.getVenueId() == null || venueId.equals(booking.getVenueId()))
                && booking.getStatus() != null
                && statusIn.contains(booking.getStatus());
    }
}
