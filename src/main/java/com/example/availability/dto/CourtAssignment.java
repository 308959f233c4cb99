package com.example.availability.dto;

import com.example.availability.model.Court;

import java.util.List;

/**
 * @param selectedCourt   null when no court is free for the whole span
 * @param availableCourts every court free for the whole span, best ranked first
 */
public record CourtAssignment(Court selectedCourt, List<Court> availableCourts, boolean available) {

    public CourtAssignment {
        availableCourts = availableCourts == null ? List.of() : List.copyOf(availableCourts);
    }

    public static CourtAssignment none() {
        return new CourtAssignment(null, List.of(), false);
    }
}
