package com.example.availability.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * How a court is picked when the user does not choose one.
 */
public enum CourtAssignmentStrategy {

    FIRST_AVAILABLE("firstAvailable"),
    LOWEST_PRICE("lowestPrice"),
    /** Weighted by court type, sport type and price */
    OPTIMAL("optimal"),
    /** The preferred court when it is free, otherwise {@link #OPTIMAL} */
    SPECIFIC("specific");

    public static final CourtAssignmentStrategy DEFAULT = OPTIMAL;

    private final String id;

    CourtAssignmentStrategy(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /** Accepts the identifier or the constant name, case-insensitive. */
    public static Optional<CourtAssignmentStrategy> fromId(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim();
        return Arrays.stream(values())
                .filter(strategy -> strategy.id.equalsIgnoreCase(normalized) || strategy.name().equalsIgnoreCase(normalized))
                .findFirst();
    }
}
