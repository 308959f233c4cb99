package com.example.availability.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One 30-minute unit of the bookable day with a per-court free flag.
 * {@code hasAvailableCourts} is always the OR of the court flags.
 */
public record TimeSlot(String time, int timeValue, Map<String, Boolean> courtAvailability, boolean hasAvailableCourts) {

    public TimeSlot {
        courtAvailability = courtAvailability == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(courtAvailability));
        hasAvailableCourts = courtAvailability.containsValue(Boolean.TRUE);
    }

    public TimeSlot(String time, int timeValue, Map<String, Boolean> courtAvailability) {
        this(time, timeValue, courtAvailability, false);
    }

    /** Unknown courts count as taken. */
    public boolean isAvailable(String courtId) {
        return Boolean.TRUE.equals(courtAvailability.get(courtId));
    }
}
