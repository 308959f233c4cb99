package com.example.availability.service;

import com.example.availability.config.AvailabilityConfig;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Open booking sessions by id. Each access extends the session; idle sessions are closed by
 * {@link SessionCleanupScheduler} so their subscriptions do not outlive them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AvailabilitySessionRegistry {

    private final AvailabilityEngine engine;
    private final AvailabilityConfig config;
    private final Clock clock;

    private final Map<String, SessionEntry> sessions = new ConcurrentHashMap<>();

    public SchedulerState open() {
        return open(UUID.randomUUID().toString());
    }

    public SchedulerState open(String sessionId) {
        SessionEntry entry = SessionEntry.builder()
                .state(engine.openSession(sessionId))
                .expiresAt(nextExpiry())
                .build();
        SessionEntry replaced = sessions.put(sessionId, entry);
        if (replaced != null) {
            replaced.getState().close();
        }
        return entry.getState();
    }

    public Optional<SchedulerState> get(String sessionId) {
        Instant now = clock.instant();
        AtomicReference<SessionEntry> expired = new AtomicReference<>();
        SessionEntry live = sessions.computeIfPresent(sessionId, (id, entry) -> {
            if (entry.getExpiresAt().isBefore(now)) {
                expired.set(entry);
                return null;
            }
            entry.setExpiresAt(now.plus(ttl()));
            return entry;
        });
        if (expired.get() != null) {
            expired.get().getState().close();
        }
        return Optional.ofNullable(live).map(SessionEntry::getState);
    }

    public void close(String sessionId) {
        SessionEntry entry = sessions.remove(sessionId);
        if (entry != null) {
            entry.getState().close();
        }
    }

    /**
     * Expiry is re-checked under the map's per-key lock, so a session refreshed by {@link #get}
     * after the scan started survives.
     *
     * @return number of sessions closed
     */
    public int closeExpired() {
        Instant now = clock.instant();
        List<String> candidates = sessions.entrySet().stream()
                .filter(e -> e.getValue().getExpiresAt().isBefore(now))
                .map(Map.Entry::getKey)
                .toList();

        int closed = 0;
        for (String sessionId : candidates) {
            AtomicReference<SessionEntry> removed = new AtomicReference<>();
            sessions.computeIfPresent(sessionId, (id, entry) -> {
                if (entry.getExpiresAt().isBefore(now)) {
                    removed.set(entry);
                    return null;
                }
                return entry;
            });
            if (removed.get() != null) {
                removed.get().getState().close();
                closed++;
            }
        }
        return closed;
    }

    public int size() {
        return sessions.size();
    }

    private Instant nextExpiry() {
        return clock.instant().plus(ttl());
    }

    private Duration ttl() {
        return Duration.ofMinutes(config.getSessionTtlMinutes());
    }

    @Data
    @Builder
    private static class SessionEntry {
        private SchedulerState state;
        private Instant expiresAt;
    }
}
