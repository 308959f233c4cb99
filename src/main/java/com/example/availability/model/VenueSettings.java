package com.example.availability.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VenueSettings {

    /** Flow identifier such as "date_time_court_duration"; null means the default flow */
    private String bookingFlow;

    private Integer minBookingMinutes;
    private Integer maxBookingMinutes;
}
