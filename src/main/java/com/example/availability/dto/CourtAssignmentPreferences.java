package com.example.availability.dto;

public record CourtAssignmentPreferences(String preferredCourtId, String preferredCourtType, String preferredSportType) {

    public static CourtAssignmentPreferences none() {
        return new CourtAssignmentPreferences(null, null, null);
    }
}
