package com.example.availability.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class SessionCleanupScheduler {

    private final AvailabilitySessionRegistry sessionRegistry;

    @Scheduled(fixedDelay = 60_000)
    public void cleanupExpired() {
        int closed = sessionRegistry.closeExpired();
        if (closed > 0) {
            log.info("Closed {} idle availability sessions, {} still open", closed, sessionRegistry.size());
        }
    }
}
