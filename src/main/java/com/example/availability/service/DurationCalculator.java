package com.example.availability.service;

import com.example.availability.dto.AvailabilitySnapshot;
import com.example.availability.dto.DurationOption;
import com.example.availability.model.Court;
import com.example.availability.model.Venue;
import com.example.availability.model.VenueSettings;
import com.example.availability.repository.CourtRegistry;
import com.example.availability.repository.VenueRegistry;
import com.example.availability.service.util.TimeInputs;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * Enumerates bookable lengths from a start time. Each candidate is checked on its own span; a bad
 * price or end time drops only that candidate.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DurationCalculator {

    static final List<Integer> CANDIDATE_MINUTES = IntStream.rangeClosed(1, 10)
            .map(i -> i * TimeInputs.SLOT_MINUTES)
            .boxed()
            .toList();

    private final CourtRegistry courtRegistry;
    private final VenueRegistry venueRegistry;
    private final PricingService pricingService;
    private final PastSlotFilter pastSlotFilter;
    private final TimezoneService timezoneService;

    public List<DurationOption> getAvailableDurations(SchedulerState state, String startTime, String courtId) {
        return getAvailableDurations(state.snapshot(), startTime, courtId, state.selection().userId());
    }

    /**
     * @param startTime ISO date-time or HH:mm on the snapshot date
     * @param courtId   null to price across every court free for the span
     */
    public List<DurationOption> getAvailableDurations(AvailabilitySnapshot snapshot, String startTime,
                                                      String courtId, String userId) {
        if (snapshot.date() == null || snapshot.timeSlots().isEmpty()) {
            return List.of();
        }
        Optional<ZonedDateTime> start = TimeInputs.parseDateTime(startTime, snapshot.date(), timezoneService.zoneId());
        if (start.isEmpty()) {
            log.warn("Invalid start time '{}', no durations offered", startTime);
            return List.of();
        }
        if (!start.get().toLocalDate().equals(snapshot.date())) {
            log.warn("Start time {} is not on {}, no durations offered", startTime, snapshot.date());
            return List.of();
        }

        int startMinutes = start.get().getHour() * 60 + start.get().getMinute();
        List<DurationOption> options = new ArrayList<>();
        for (int minutes : candidatesFor(snapshot.venueId())) {
            toOption(snapshot, start.get(), startMinutes, minutes, courtId, userId).ifPresent(options::add);
        }
        return options;
    }

    /** "30m", "1h", "1.5h" ... */
    public static String label(int minutes) {
        if (minutes < 60) {
            return minutes + "m";
        }
        return minutes % 60 == 0 ? minutes / 60 + "h" : minutes / 60 + ".5h";
    }

    private Optional<DurationOption> toOption(AvailabilitySnapshot snapshot, ZonedDateTime start, int startMinutes,
                                              int minutes, String courtId, String userId) {
        if (startMinutes + minutes > TimeInputs.END_OF_DAY) {
            log.debug("{} from {} runs past midnight, dropped", label(minutes), start);
            return Optional.empty();
        }
        List<Integer> span = TimeInputs.subSlots(startMinutes, minutes);
        List<String> freeCourts = snapshot.activeCourtIds().stream()
                .filter(id -> isFree(snapshot, id, span))
                .toList();

        String startIso = start.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        String endIso = start.plusMinutes(minutes).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);

        if (courtId != null && !courtId.isBlank()) {
            if (!freeCourts.contains(courtId)) {
                return Optional.empty();
            }
            return courtRegistry.findById(courtId)
                    .flatMap(court -> price(court, startIso, endIso, userId))
                    .map(price -> new DurationOption(label(minutes), minutes, price, courtId, freeCourts));
        }

        if (freeCourts.isEmpty()) {
            return Optional.empty();
        }
        List<BigDecimal> prices = freeCourts.stream()
                .map(courtRegistry::findById)
                .flatMap(Optional::stream)
                .map(court -> price(court, startIso, endIso, userId))
                .flatMap(Optional::stream)
                .toList();
        if (prices.isEmpty()) {
            log.warn("No court could be priced for {} from {}, dropped", label(minutes), startIso);
            return Optional.empty();
        }
        // mean over the free courts
        BigDecimal mean = prices.stream()
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .divide(BigDecimal.valueOf(prices.size()), 2, RoundingMode.HALF_UP);
        return Optional.of(new DurationOption(label(minutes), minutes, mean, null, freeCourts));
    }

    private boolean isFree(AvailabilitySnapshot snapshot, String courtId, List<Integer> span) {
        return span.stream().allMatch(minutes -> snapshot.slotAt(minutes)
                .map(slot -> slot.isAvailable(courtId))
                .orElse(false)
                && !pastSlotFilter.isPast(snapshot.date(), minutes));
    }

    private Optional<BigDecimal> price(Court court, String startIso, String endIso, String userId) {
        try {
            BigDecimal price = pricingService.calculatePrice(court, startIso, endIso, userId);
            if (price == null || price.signum() < 0) {
                log.warn("Pricing returned {} for court {} {} - {}, skipped", price, court.getId(), startIso, endIso);
                return Optional.empty();
            }
            return Optional.of(price);
        } catch (RuntimeException e) {
            log.warn("Pricing failed for court {} {} - {}: {}", court.getId(), startIso, endIso, e.getMessage());
            return Optional.empty();
        }
    }

    private List<Integer> candidatesFor(String venueId) {
        Optional<VenueSettings> settings = venueRegistry.findById(venueId).map(Venue::getSettings);
        int min = settings.map(VenueSettings::getMinBookingMinutes).orElse(0);
        int max = settings.map(VenueSettings::getMaxBookingMinutes).orElse(Integer.MAX_VALUE);
        return CANDIDATE_MINUTES.stream()
                .filter(minutes -> minutes >= min && minutes <= max)
                .toList();
    }
}
