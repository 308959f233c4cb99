package com.example.availability.service;

import com.example.availability.model.BookingFlowType;
import com.example.availability.model.Venue;
import com.example.availability.model.VenueSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Slf4j
@Component
public class FlowResolver {

    public BookingFlowType resolve(Venue venue) {
        String configured = Optional.ofNullable(venue)
                .map(Venue::getSettings)
                .map(VenueSettings::getBookingFlow)
                .orElse(null);
        if (configured == null || configured.isBlank()) {
            return BookingFlowType.DEFAULT;
        }

        return BookingFlowType.fromId(configured).orElseGet(() -> {
            log.warn("Venue {} has unknown booking flow '{}', using {}",
                    venue.getId(), configured, BookingFlowType.DEFAULT.id());
            return BookingFlowType.DEFAULT;
        });
    }
}
