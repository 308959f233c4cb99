package com.example.availability.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Venue {

    private String id;
    private String name;

    /**
     * Opening hours per weekday. An empty map means the default operating window;
     * a weekday missing from a non-empty map means the venue is closed that day.
     */
    @Builder.Default
    private Map<DayOfWeek, OpeningHours> operatingHours = Map.of();

    private VenueSettings settings;
}
