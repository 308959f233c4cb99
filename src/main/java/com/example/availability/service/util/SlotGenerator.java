package com.example.availability.service.util;

import com.example.availability.dto.OperatingWindow;
import com.example.availability.dto.TimeSlot;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.example.availability.service.util.TimeInputs.SLOT_MINUTES;

public final class SlotGenerator {

    private SlotGenerator() {
    }

    /**
     * Slot skeleton for one day with every court free. On the venue-local current day the
     * window starts at the current hour, so earlier slots are never generated.
     *
     * @param now venue-local current time
     */
    public static List<TimeSlot> generate(LocalDate date, OperatingWindow window, List<String> courtIds, LocalDateTime now) {
        int lower = TimeInputs.alignUp(window.openMinutes());
        int upper = TimeInputs.alignDown(window.closeMinutes());

        if (now != null && date.equals(now.toLocalDate())) {
            lower = Math.max(lower, now.getHour() * 60);
        }

        List<TimeSlot> slots = new ArrayList<>();
        for (int minutes = lower; minutes < upper; minutes += SLOT_MINUTES) {
            Map<String, Boolean> courts = new LinkedHashMap<>();
            courtIds.forEach(courtId -> courts.put(courtId, Boolean.TRUE));
            slots.add(new TimeSlot(TimeInputs.label(minutes), minutes, courts));
        }
        return slots;
    }
}
