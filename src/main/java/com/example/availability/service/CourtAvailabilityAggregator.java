package com.example.availability.service;

import com.example.availability.dto.AvailabilitySnapshot;
import com.example.availability.dto.BookingSelection;
import com.example.availability.dto.CourtAvailabilityStatus;
import com.example.availability.dto.TimeSlot;
import com.example.availability.dto.TimeSlotOverview;
import com.example.availability.model.Court;
import com.example.availability.repository.CourtRegistry;
import com.example.availability.service.util.TimeInputs;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class CourtAvailabilityAggregator {

    static final int DEFAULT_DURATION_MINUTES = 30;

    private static final Comparator<CourtAvailabilityStatus> RANKING =
            Comparator.comparing(CourtAvailabilityStatus::fullyAvailable).reversed()
                    .thenComparing(status -> status.availableTimeSlots().size(), Comparator.reverseOrder())
                    .thenComparing(CourtAvailabilityStatus::courtName, Comparator.nullsLast(Comparator.naturalOrder()));

    private final CourtRegistry courtRegistry;
    private final PastSlotFilter pastSlotFilter;
    private final TimezoneService timezoneService;

    public List<CourtAvailabilityStatus> getAllCourtsAvailability(SchedulerState state, String startTime, Integer durationMinutes) {
        return getAllCourtsAvailability(state.snapshot(), state.selection(), startTime, durationMinutes);
    }

    /**
     * One status per active court for {@code [start, start + duration)}. Missing start or duration are
     * taken from the selection; duration falls back to 30 minutes.
     */
    public List<CourtAvailabilityStatus> getAllCourtsAvailability(AvailabilitySnapshot snapshot,
                                                                  BookingSelection selection,
                                                                  String startTime,
                                                                  Integer durationMinutes) {
        if (snapshot.date() == null) {
            return List.of();
        }
        BookingSelection current = selection == null ? BookingSelection.empty() : selection;
        String effectiveStart = startTime != null && !startTime.isBlank() ? startTime : current.startTime();

        Optional<Integer> startMinutes = startMinutes(snapshot, effectiveStart);
        if (startMinutes.isEmpty()) {
            log.warn("Invalid start time '{}', no court availability computed", effectiveStart);
            return List.of();
        }
        int duration = durationMinutes != null && durationMinutes > 0
                ? durationMinutes
                : selectedDuration(snapshot, current).orElse(DEFAULT_DURATION_MINUTES);

        List<Integer> span = TimeInputs.subSlots(startMinutes.get(), duration);
        return snapshot.activeCourtIds().stream()
                .map(courtId -> status(snapshot, courtId, span))
                .sorted(RANKING)
                .toList();
    }

    /** Courts free for the whole span other than {@code currentCourtId}, best ranked first. */
    public List<Court> alternativeCourts(SchedulerState state, String startTime, int durationMinutes, String currentCourtId) {
        if (startTime == null || durationMinutes <= 0) {
            return List.of();
        }
        return getAllCourtsAvailability(state.snapshot(), state.selection(), startTime, durationMinutes).stream()
                .filter(CourtAvailabilityStatus::fullyAvailable)
                .filter(status -> !Objects.equals(status.courtId(), currentCourtId))
                .map(status -> courtRegistry.findById(status.courtId()))
                .flatMap(Optional::stream)
                .toList();
    }

    /** Per slot, which courts are free and which are taken. Elapsed slots are left out. */
    public List<TimeSlotOverview> timeSlotOverview(AvailabilitySnapshot snapshot) {
        if (snapshot.date() == null) {
            return List.of();
        }
        List<TimeSlotOverview> overview = new ArrayList<>();
        for (TimeSlot slot : snapshot.timeSlots()) {
            if (pastSlotFilter.isPast(snapshot.date(), slot.timeValue())) {
                continue;
            }
            List<String> available = new ArrayList<>();
            List<String> unavailable = new ArrayList<>();
            for (Map.Entry<String, Boolean> entry : slot.courtAvailability().entrySet()) {
                (Boolean.TRUE.equals(entry.getValue()) ? available : unavailable).add(entry.getKey());
            }
            overview.add(new TimeSlotOverview(slot.time(), slot.timeValue(), available, unavailable));
        }
        return overview;
    }

    private CourtAvailabilityStatus status(AvailabilitySnapshot snapshot, String courtId, List<Integer> span) {
        List<String> available = new ArrayList<>();
        List<String> unavailable = new ArrayList<>();
        for (int minutes : span) {
            boolean free = snapshot.slotAt(minutes)
                    .map(slot -> slot.isAvailable(courtId))
                    .orElse(false);
            (free ? available : unavailable).add(TimeInputs.label(minutes));
        }
        String name = courtRegistry.findById(courtId).map(Court::getName).orElse(courtId);
        return new CourtAvailabilityStatus(courtId, name, !available.isEmpty(), unavailable.isEmpty(),
                available, unavailable);
    }

    private Optional<Integer> startMinutes(AvailabilitySnapshot snapshot, String startTime) {
        return TimeInputs.parseDateTime(startTime, snapshot.date(), timezoneService.zoneId())
                .filter(start -> start.toLocalDate().equals(snapshot.date()))
                .map(start -> start.getHour() * 60 + start.getMinute());
    }

    private Optional<Integer> selectedDuration(AvailabilitySnapshot snapshot, BookingSelection selection) {
        Optional<ZonedDateTime> start = TimeInputs.parseDateTime(selection.startTime(), snapshot.date(), timezoneService.zoneId());
        Optional<ZonedDateTime> end = TimeInputs.parseDateTime(selection.endTime(), snapshot.date(), timezoneService.zoneId());
        if (start.isEmpty() || end.isEmpty()) {
            return Optional.empty();
        }
        long minutes = Duration.between(start.get(), end.get()).toMinutes();
        return minutes > 0 ? Optional.of((int) minutes) : Optional.empty();
    }
}
