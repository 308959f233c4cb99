package com.example.availability.repository;

import com.example.availability.model.Court;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public interface CourtRegistry {

    Collection<Court> courts();

    Optional<Court> findById(String courtId);

    /** Listener fires after any court is added, changed or removed. */
    Subscription onChange(Runnable listener);

    default List<Court> findActiveByVenue(String venueId) {
        return courts().stream()
                .filter(court -> Objects.equals(venueId, court.getVenueId()))
                .filter(Court::isActive)
                .sorted(Comparator.comparing(Court::getName, Comparator.nullsLast(Comparator.naturalOrder()))
                        .thenComparing(Court::getId))
                .toList();
    }
}
