package com.example.availability.repository.impl;

import com.example.availability.model.Venue;
import com.example.availability.repository.Subscription;
import com.example.availability.repository.VenueRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

@Slf4j
@Component
public class InMemoryVenueRegistry implements VenueRegistry {

    private final Map<String, Venue> venues = new ConcurrentHashMap<>();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    @Override
    public Collection<Venue> venues() {
        return List.copyOf(venues.values());
    }

    @Override
    public Optional<Venue> findById(String venueId) {
        return venueId == null ? Optional.empty() : Optional.ofNullable(venues.get(venueId));
    }

    @Override
    public Subscription onChange(Runnable listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public Venue save(Venue venue) {
        venues.put(venue.getId(), venue);
        log.debug("Venue {} saved", venue.getId());
        listeners.forEach(listener -> {
            try {
                listener.run();
            } catch (Exception e) {
                log.warn("Venue change listener failed: {}", e.getMessage());
            }
        });
        return venue;
    }
}
