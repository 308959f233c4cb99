package com.example.availability.controllers;

import com.example.availability.dto.AvailabilityResponse;
import com.example.availability.dto.AvailabilitySnapshot;
import com.example.availability.dto.BookingSelection;
import com.example.availability.dto.CourtAssignment;
import com.example.availability.dto.CourtAssignmentPreferences;
import com.example.availability.dto.CourtAvailabilityStatus;
import com.example.availability.dto.DurationOption;
import com.example.availability.dto.FlowView;
import com.example.availability.dto.TimeSlotOption;
import com.example.availability.dto.TimeSlotOverview;
import com.example.availability.model.CourtAssignmentStrategy;
import com.example.availability.model.Venue;
import com.example.availability.repository.VenueRegistry;
import com.example.availability.service.AvailabilityEngine;
import com.example.availability.service.CourtAssignmentService;
import com.example.availability.service.CourtAvailabilityAggregator;
import com.example.availability.service.DurationCalculator;
import com.example.availability.service.FlowResolver;
import com.example.availability.service.exception.InvalidTimeInputException;
import com.example.availability.service.exception.VenueNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Read-only availability queries. Every request computes a fresh snapshot; nothing is kept between calls.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AvailabilityController {

    private final AvailabilityEngine engine;
    private final DurationCalculator durationCalculator;
    private final CourtAvailabilityAggregator courtAggregator;
    private final VenueRegistry venueRegistry;
    private final FlowResolver flowResolver;
    private final CourtAssignmentService courtAssignmentService;

    @GetMapping("/availability")
    public AvailabilityResponse availability(@RequestParam String venueId, @RequestParam String date) {
        AvailabilitySnapshot snapshot = engine.computeOnce(venueId, parseDate(date));
        return AvailabilityResponse.of(snapshot, engine.getAvailableTimeSlots(snapshot));
    }

    @GetMapping("/availability/time-slots")
    public List<TimeSlotOption> timeSlots(@RequestParam String venueId, @RequestParam String date) {
        return engine.getAvailableTimeSlots(engine.computeOnce(venueId, parseDate(date)));
    }

    @GetMapping("/availability/overview")
    public List<TimeSlotOverview> overview(@RequestParam String venueId, @RequestParam String date) {
        return courtAggregator.timeSlotOverview(engine.computeOnce(venueId, parseDate(date)));
    }

    @GetMapping("/availability/durations")
    public List<DurationOption> durations(@RequestParam String venueId,
                                          @RequestParam String date,
                                          @RequestParam String startTime,
                                          @RequestParam(required = false) String courtId,
                                          @RequestParam(required = false) String userId) {
        AvailabilitySnapshot snapshot = engine.computeOnce(venueId, parseDate(date));
        return durationCalculator.getAvailableDurations(snapshot, startTime, courtId, userId);
    }

    @GetMapping("/availability/courts")
    public List<CourtAvailabilityStatus> courts(@RequestParam String venueId,
                                                @RequestParam String date,
                                                @RequestParam String startTime,
                                                @RequestParam(required = false) Integer duration) {
        LocalDate day = parseDate(date);
        AvailabilitySnapshot snapshot = engine.computeOnce(venueId, day);
        BookingSelection selection = BookingSelection.builder().venueId(venueId).date(day).build();
        return courtAggregator.getAllCourtsAvailability(snapshot, selection, startTime, duration);
    }

    @GetMapping("/availability/assign")
    public CourtAssignment assign(@RequestParam String venueId,
                                  @RequestParam String date,
                                  @RequestParam String startTime,
                                  @RequestParam int duration,
                                  @RequestParam(required = false) String strategy,
                                  @RequestParam(required = false) String courtId,
                                  @RequestParam(required = false) String courtType,
                                  @RequestParam(required = false) String sportType) {
        LocalDate day = parseDate(date);
        AvailabilitySnapshot snapshot = engine.computeOnce(venueId, day);
        BookingSelection selection = BookingSelection.builder().venueId(venueId).date(day).build();
        return courtAssignmentService.assign(snapshot, selection, startTime, duration, parseStrategy(strategy),
                new CourtAssignmentPreferences(courtId, courtType, sportType));
    }

    @GetMapping("/venues/{venueId}/flow")
    public FlowView flow(@PathVariable String venueId) {
        Venue venue = venueRegistry.findById(venueId)
                .orElseThrow(() -> new VenueNotFoundException(venueId));
        return FlowView.of(venueId, flowResolver.resolve(venue));
    }

    private static CourtAssignmentStrategy parseStrategy(String raw) {
        if (raw == null) {
            return CourtAssignmentStrategy.DEFAULT;
        }
        return CourtAssignmentStrategy.fromId(raw).orElseGet(() -> {
            log.warn("Unknown assignment strategy '{}', using {}", raw, CourtAssignmentStrategy.DEFAULT.id());
            return CourtAssignmentStrategy.DEFAULT;
        });
    }

    private static LocalDate parseDate(String raw) {
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException e) {
            log.warn("Rejected request with invalid date '{}'", raw);
            throw new InvalidTimeInputException("Invalid date: " + raw, e);
        }
    }
}
