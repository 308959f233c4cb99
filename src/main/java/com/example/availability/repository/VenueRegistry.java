package com.example.availability.repository;

import com.example.availability.model.Venue;

import java.util.Collection;
import java.util.Optional;

public interface VenueRegistry {

    Collection<Venue> venues();

    Optional<Venue> findById(String venueId);

    Subscription onChange(Runnable listener);
}
