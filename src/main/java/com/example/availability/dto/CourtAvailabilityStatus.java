package com.example.availability.dto;

import java.util.List;

public record CourtAvailabilityStatus(String courtId,
                                      String courtName,
                                      boolean available,
                                      boolean fullyAvailable,
                                      List<String> availableTimeSlots,
                                      List<String> unavailableTimeSlots) {

    public CourtAvailabilityStatus {
        availableTimeSlots = List.copyOf(availableTimeSlots);
        unavailableTimeSlots = List.copyOf(unavailableTimeSlots);
    }
}
