package com.example.availability.dto;

import lombok.Builder;

import java.time.LocalDate;
import java.util.Objects;

/**
 * What the user has picked so far in the booking wizard.
 */
@Builder(toBuilder = true)
public record BookingSelection(String venueId,
                               LocalDate date,
                               String courtId,
                               String startTime,
                               String endTime,
                               String userId) {

    public static BookingSelection empty() {
        return BookingSelection.builder().build();
    }

    public boolean isComplete() {
        return date != null && venueId != null && !venueId.isBlank();
    }

    public boolean sameDay(BookingSelection other) {
        return other != null && Objects.equals(date, other.date) && Objects.equals(venueId, other.venueId);
    }
}
