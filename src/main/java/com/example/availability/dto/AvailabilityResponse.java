package com.example.availability.dto;

import java.time.LocalDate;
import java.util.List;

/**
 * Read view of a snapshot: slots flattened with elapsed ones marked unavailable, bookings left out.
 */
public record AvailabilityResponse(LocalDate date,
                                   String venueId,
                                   String venueName,
                                   String flowType,
                                   List<String> activeCourtIds,
                                   List<TimeSlotOption> timeSlots,
                                   String error) {

    public static AvailabilityResponse of(AvailabilitySnapshot snapshot, List<TimeSlotOption> timeSlots) {
        return new AvailabilityResponse(snapshot.date(), snapshot.venueId(), snapshot.venueName(),
                snapshot.flowType().id(), snapshot.activeCourtIds(), timeSlots, snapshot.error());
    }
}
