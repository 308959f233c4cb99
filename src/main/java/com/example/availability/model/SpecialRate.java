package com.example.availability.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Set;

/**
 * Named rate overriding base and peak pricing on the given days, optionally within a time window.
 * The window is only applied when both bounds are set.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SpecialRate {

    private String name;
    private BigDecimal rate;

    /** Null means every day */
    private Set<DayOfWeek> applyDays;

    private LocalTime startTime;
    private LocalTime endTime;

    public boolean appliesAt(DayOfWeek day, LocalTime time) {
        if (rate == null) {
            return false;
        }
        if (applyDays != null && !applyDays.contains(day)) {
            return false;
        }
        if (startTime != null && endTime != null) {
            return !time.isBefore(startTime) && time.isBefore(endTime);
        }
        return true;
    }
}
