package com.example.availability.dto;

import java.math.BigDecimal;
import java.util.List;

/**
 * A bookable length starting at the requested time.
 *
 * @param courtId           the court the price was computed for, or null when the price is averaged
 * @param availableCourtIds courts free for the whole span
 */
public record DurationOption(String label, int minutes, BigDecimal price, String courtId, List<String> availableCourtIds) {

    public DurationOption {
        availableCourtIds = availableCourtIds == null ? List.of() : List.copyOf(availableCourtIds);
    }
}
