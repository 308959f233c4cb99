package com.example.availability.service;

import com.example.availability.config.AvailabilityConfig;
import com.example.availability.dto.AvailabilitySnapshot;
import com.example.availability.dto.BookingFilter;
import com.example.availability.dto.TimeSlot;
import com.example.availability.dto.TimeSlotOption;
import com.example.availability.model.Booking;
import com.example.availability.model.BookingFlowType;
import com.example.availability.model.Court;
import com.example.availability.model.Venue;
import com.example.availability.repository.BookingStore;
import com.example.availability.repository.CourtRegistry;
import com.example.availability.repository.VenueRegistry;
import com.example.availability.service.exception.VenueNotFoundException;
import com.example.availability.service.util.BookingOccupancyMapper;
import com.example.availability.service.util.OperatingHoursResolver;
import com.example.availability.service.util.SlotGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

/**
 * Builds availability snapshots from the registries. Sessions get a {@link SchedulerState} that keeps
 * its snapshot current; the REST layer uses {@link #computeOnce} instead.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AvailabilityEngine {

    private final CourtRegistry courtRegistry;
    private final VenueRegistry venueRegistry;
    private final BookingStore bookingStore;
    private final FlowResolver flowResolver;
    private final PastSlotFilter pastSlotFilter;
    private final TimezoneService timezoneService;
    private final AvailabilityConfig config;

    public SchedulerState openSession(String sessionId) {
        SchedulerState state = new SchedulerState(sessionId, this, courtRegistry, venueRegistry, bookingStore);
        state.start();
        log.info("Availability session {} opened", sessionId);
        return state;
    }

    /**
     * Active courts and the free slot skeleton for one day. A venue closed that day yields an empty skeleton.
     */
    public PreparedDay prepare(String venueId, LocalDate date) {
        Venue venue = venueRegistry.findById(venueId).orElse(null);
        List<String> courtIds = courtRegistry.findActiveByVenue(venueId).stream()
                .map(Court::getId)
                .toList();

        List<TimeSlot> skeleton = courtIds.isEmpty()
                ? List.of()
                : OperatingHoursResolver.windowFor(venue, date, config.defaultWindow())
                        .map(window -> SlotGenerator.generate(date, window, courtIds,
                                timezoneService.now().toLocalDateTime()))
                        .orElseGet(() -> {
                            log.debug("Venue {} is closed on {}", venueId, date);
                            return List.of();
                        });

        return new PreparedDay(venueId, date, venue == null ? null : venue.getName(), courtIds, skeleton);
    }

    public AvailabilitySnapshot occupy(PreparedDay day, List<Booking> bookings, BookingFlowType flowType) {
        List<Booking> occupying = BookingOccupancyMapper.occupying(bookings, day.date());
        List<TimeSlot> slots = BookingOccupancyMapper.apply(day.skeleton(), occupying, day.date(),
                timezoneService.zoneId());
        return new AvailabilitySnapshot(day.date(), day.venueId(), day.venueName(), slots,
                day.activeCourtIds(), occupying, flowType, false, null);
    }

    public BookingFlowType resolveFlow(String venueId) {
        return flowResolver.resolve(venueRegistry.findById(venueId).orElse(null));
    }

    /**
     * One-shot snapshot from the current registries, no subscription kept.
     *
     * @throws VenueNotFoundException when the venue is unknown
     */
    public AvailabilitySnapshot computeOnce(String venueId, LocalDate date) {
        Venue venue = venueRegistry.findById(venueId)
                .orElseThrow(() -> new VenueNotFoundException(venueId));
        BookingFlowType flowType = flowResolver.resolve(venue);
        PreparedDay day = prepare(venueId, date);

        if (day.activeCourtIds().isEmpty()) {
            return AvailabilitySnapshot.noActiveCourts(date, venueId, venue.getName(), flowType);
        }

        List<Booking> bookings;
        try {
            bookings = bookingStore.find(BookingFilter.active(date, venueId));
        } catch (RuntimeException e) {
            log.error("Failed to read bookings for venue {} on {}", venueId, date, e);
            return new AvailabilitySnapshot(date, venueId, venue.getName(), day.skeleton(), day.activeCourtIds(),
                    List.of(), flowType, false, AvailabilitySnapshot.LOAD_FAILED);
        }
        return occupy(day, bookings, flowType);
    }

    /** Flattened slot list with elapsed slots marked unavailable. */
    public List<TimeSlotOption> getAvailableTimeSlots(AvailabilitySnapshot snapshot) {
        if (snapshot.date() == null) {
            return List.of();
        }
        List<TimeSlotOption> options = snapshot.timeSlots().stream()
                .map(slot -> new TimeSlotOption(slot.time(), slot.timeValue(), slot.hasAvailableCourts()))
                .toList();
        return pastSlotFilter.apply(snapshot.date(), options);
    }

    public record PreparedDay(String venueId,
                              LocalDate date,
                              String venueName,
                              List<String> activeCourtIds,
                              List<TimeSlot> skeleton) {
    }
}
