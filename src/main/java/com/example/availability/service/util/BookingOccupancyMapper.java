package com.example.availability.service.util;

import com.example.availability.dto.TimeSlot;
import com.example.availability.model.Booking;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
public final class BookingOccupancyMapper {

    private BookingOccupancyMapper() {
    }

    /**
     * Marks every slot whose start lies in a booking's {@code [start, end)} as taken for that
     * booking's court. Writes only flip free to taken, so booking order does not matter.
     * The skeleton is not modified.
     */
    public static List<TimeSlot> apply(List<TimeSlot> skeleton, Collection<Booking> bookings, LocalDate date, ZoneId zone) {
        Map<Integer, Map<String, Boolean>> working = new LinkedHashMap<>();
        skeleton.forEach(slot -> working.put(slot.timeValue(), new LinkedHashMap<>(slot.courtAvailability())));

        for (Booking booking : occupying(bookings, date)) {
            Optional<int[]> range = minuteRange(booking, date, zone);
            if (range.isEmpty()) {
                continue;
            }
            int start = range.get()[0];
            int end = range.get()[1];

            boolean known = false;
            for (Map.Entry<Integer, Map<String, Boolean>> entry : working.entrySet()) {
                Map<String, Boolean> courts = entry.getValue();
                if (!courts.containsKey(booking.getCourtId())) {
                    continue;
                }
                known = true;
                if (entry.getKey() >= start && entry.getKey() < end) {
                    courts.put(booking.getCourtId(), Boolean.FALSE);
                }
            }
            if (!known && !working.isEmpty()) {
                log.debug("Booking {} references court {} which is not active, ignored",
                        booking.getId(), booking.getCourtId());
            }
        }

        return skeleton.stream()
                .map(slot -> new TimeSlot(slot.time(), slot.timeValue(), working.get(slot.timeValue())))
                .toList();
    }

    /** Bookings that hold a court on {@code date}: active status and matching date. */
    public static List<Booking> occupying(Collection<Booking> bookings, LocalDate date) {
        return bookings.stream()
                .filter(Booking::isOccupying)
                .filter(booking -> booking.getDate() == null || booking.getDate().equals(date))
                .toList();
    }

    private static Optional<int[]> minuteRange(Booking booking, LocalDate date, ZoneId zone) {
        Optional<ZonedDateTime> start = TimeInputs.parseDateTime(booking.getStartTime(), date, zone);
        Optional<ZonedDateTime> end = TimeInputs.parseDateTime(booking.getEndTime(), date, zone);
        if (start.isEmpty() || end.isEmpty()) {
            log.warn("Booking {} has unparseable times {} - {}, ignored",
                    booking.getId(), booking.getStartTime(), booking.getEndTime());
            return Optional.empty();
        }

        int startMinutes = TimeInputs.minutesOnDate(start.get(), date);
        int endMinutes = TimeInputs.minutesOnDate(end.get(), date);
        if (endMinutes <= startMinutes) {
            log.warn("Booking {} does not cover any time on {}, ignored", booking.getId(), date);
            return Optional.empty();
        }
        return Optional.of(new int[]{startMinutes, endMinutes});
    }
}
