package com.example.availability.dto;

import com.example.availability.model.Booking;
import com.example.availability.model.BookingFlowType;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Fully computed availability for one (venue, date) selection. Never patched in place:
 * every change produces a new instance.
 */
public record AvailabilitySnapshot(LocalDate date,
                                   String venueId,
                                   String venueName,
                                   List<TimeSlot> timeSlots,
                                   List<String> activeCourtIds,
                                   List<Booking> bookings,
                                   BookingFlowType flowType,
                                   boolean loading,
                                   String error) {

    public static final String NO_ACTIVE_COURTS = "No active courts found for this venue";
    public static final String LOAD_FAILED = "Failed to load availability data";

    public AvailabilitySnapshot {
        timeSlots = timeSlots == null ? List.of() : List.copyOf(timeSlots);
        activeCourtIds = activeCourtIds == null ? List.of() : List.copyOf(activeCourtIds);
        bookings = bookings == null ? List.of() : List.copyOf(bookings);
        flowType = flowType == null ? BookingFlowType.DEFAULT : flowType;
    }

    public static AvailabilitySnapshot initial() {
        return new AvailabilitySnapshot(null, null, null, List.of(), List.of(), List.of(),
                BookingFlowType.DEFAULT, false, null);
    }

    public static AvailabilitySnapshot noActiveCourts(LocalDate date, String venueId, String venueName,
                                                      BookingFlowType flowType) {
        return new AvailabilitySnapshot(date, venueId, venueName, List.of(), List.of(), List.of(),
                flowType, false, NO_ACTIVE_COURTS);
    }

    public AvailabilitySnapshot toLoading() {
        return new AvailabilitySnapshot(date, venueId, venueName, timeSlots, activeCourtIds, bookings,
                flowType, true, null);
    }

    public boolean isFor(LocalDate otherDate, String otherVenueId) {
        return date != null && date.equals(otherDate) && venueId != null && venueId.equals(otherVenueId);
    }

    public Optional<TimeSlot> slotAt(int minutes) {
        return timeSlots.stream()
                .filter(slot -> slot.timeValue() == minutes)
                .findFirst();
    }
}
