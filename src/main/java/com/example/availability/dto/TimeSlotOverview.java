package com.example.availability.dto;

import java.util.List;

public record TimeSlotOverview(String time,
                               int timeValue,
                               List<String> availableCourts,
                               List<String> unavailableCourts) {

    public TimeSlotOverview {
        availableCourts = List.copyOf(availableCourts);
        unavailableCourts = List.copyOf(unavailableCourts);
    }

    public boolean hasAvailableCourts() {
        return !availableCourts.isEmpty();
    }
}
