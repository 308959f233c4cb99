package com.example.availability.service;

import com.example.availability.dto.AvailabilitySnapshot;
import com.example.availability.dto.BookingSelection;
import com.example.availability.dto.CourtAssignment;
import com.example.availability.dto.CourtAssignmentPreferences;
import com.example.availability.dto.CourtAvailabilityStatus;
import com.example.availability.model.Court;
import com.example.availability.model.CourtAssignmentStrategy;
import com.example.availability.repository.CourtRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Picks a court for a time span among the courts free for all of it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CourtAssignmentService {

    static final double COURT_TYPE_WEIGHT = 3;
    static final double SPORT_TYPE_WEIGHT = 4;
    static final double PRICE_WEIGHT = 2;

    private final CourtAvailabilityAggregator courtAggregator;
    private final CourtRegistry courtRegistry;

    public CourtAssignment assign(SchedulerState state, String startTime, int durationMinutes,
                                  CourtAssignmentStrategy strategy, CourtAssignmentPreferences preferences) {
        return assign(state.snapshot(), state.selection(), startTime, durationMinutes, strategy, preferences);
    }

    public CourtAssignment assign(AvailabilitySnapshot snapshot,
                                  BookingSelection selection,
                                  String startTime,
                                  int durationMinutes,
                                  CourtAssignmentStrategy strategy,
                                  CourtAssignmentPreferences preferences) {
        if (durationMinutes <= 0) {
            return CourtAssignment.none();
        }
        List<Court> available = courtAggregator
                .getAllCourtsAvailability(snapshot, selection, startTime, durationMinutes).stream()
                .filter(CourtAvailabilityStatus::fullyAvailable)
                .map(status -> courtRegistry.findById(status.courtId()))
                .flatMap(Optional::stream)
                .toList();
        if (available.isEmpty()) {
            log.debug("No court free at {} for {} minutes", startTime, durationMinutes);
            return CourtAssignment.none();
        }

        CourtAssignmentPreferences prefs = preferences == null ? CourtAssignmentPreferences.none() : preferences;
        CourtAssignmentStrategy effective = strategy == null ? CourtAssignmentStrategy.DEFAULT : strategy;
        Court selected = switch (effective) {
            case FIRST_AVAILABLE -> available.get(0);
            case LOWEST_PRICE -> available.stream()
                    .min(Comparator.comparing(CourtAssignmentService::baseRate))
                    .orElseThrow();
            case SPECIFIC -> available.stream()
                    .filter(court -> Objects.equals(court.getId(), prefs.preferredCourtId()))
                    .findFirst()
                    .orElseGet(() -> optimal(available, prefs));
            case OPTIMAL -> optimal(available, prefs);
        };
        log.debug("Assigned court {} by {} out of {} free", selected.getId(), effective.id(), available.size());
        return new CourtAssignment(selected, available, true);
    }

    /** Highest score wins; equal scores keep the ranking order. */
    private static Court optimal(List<Court> available, CourtAssignmentPreferences prefs) {
        if (available.size() == 1) {
            return available.get(0);
        }
        BigDecimal maxRate = available.stream()
                .map(CourtAssignmentService::baseRate)
                .max(Comparator.naturalOrder())
                .orElse(BigDecimal.ZERO);

        Court best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (Court court : available) {
            double score = score(court, prefs, maxRate);
            if (score > bestScore) {
                best = court;
                bestScore = score;
            }
        }
        return best;
    }

    private static double score(Court court, CourtAssignmentPreferences prefs, BigDecimal maxRate) {
        double score = 0;
        if (prefs.preferredCourtType() != null && prefs.preferredCourtType().equals(court.getCourtType())) {
            score += COURT_TYPE_WEIGHT;
        }
        if (prefs.preferredSportType() != null && court.getSportTypes() != null
                && court.getSportTypes().contains(prefs.preferredSportType())) {
            score += SPORT_TYPE_WEIGHT;
        }
        if (maxRate.signum() > 0) {
            score += (1 - baseRate(court).doubleValue() / maxRate.doubleValue()) * PRICE_WEIGHT;
        }
        return score;
    }

    private static BigDecimal baseRate(Court court) {
        return court.getPricing() == null || court.getPricing().getBaseHourlyRate() == null
                ? BigDecimal.ZERO
                : court.getPricing().getBaseHourlyRate();
    }
}
