package com.example.availability.repository.impl;

import com.example.availability.model.Court;
import com.example.availability.repository.CourtRegistry;
import com.example.availability.repository.Subscription;
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
public class InMemoryCourtRegistry implements CourtRegistry {

    private final Map<String, Court> courts = new ConcurrentHashMap<>();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    @Override
    public Collection<Court> courts() {
        return List.copyOf(courts.values());
    }

    @Override
    public Optional<Court> findById(String courtId) {
        return courtId == null ? Optional.empty() : Optional.ofNullable(courts.get(courtId));
    }

    @Override
    public Subscription onChange(Runnable listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public Court save(Court court) {
        courts.put(court.getId(), court);
        log.debug("Court {} saved with status {}", court.getId(), court.getStatus());
        notifyListeners();
        return court;
    }

    public void remove(String courtId) {
        if (courts.remove(courtId) != null) {
            notifyListeners();
        }
    }

    private void notifyListeners() {
        for (Runnable listener : listeners) {
            try {
                listener.run();
            } catch (Exception e) {
                log.warn("Court change listener failed: {}", e.getMessage());
            }
        }
    }
}
