package com.example.availability.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Court {

    private String id;
    private String name;
    private String venueId;

    @Builder.Default
    private CourtStatus status = CourtStatus.ACTIVE;

    private CourtPricing pricing;

    /** Surface, e.g. "clay" or "hard" */
    private String courtType;

    @Builder.Default
    private Set<String> sportTypes = Set.of();

    public boolean isActive() {
        return status == CourtStatus.ACTIVE;
    }
}
