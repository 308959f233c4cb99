package com.example.availability.service.util;

import com.example.availability.dto.OperatingWindow;
import com.example.availability.model.OpeningHours;
import com.example.availability.model.Venue;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.util.Map;

import static com.example.availability.Fixtures.DAY;
import static org.assertj.core.api.Assertions.assertThat;

class OperatingHoursResolverTest {

    private static final OperatingWindow DEFAULTS = new OperatingWindow(8 * 60, 22 * 60);

    @Test
    void venueWithoutHoursUsesDefaults() {
        Venue venue = Venue.builder().id("v").build();

        assertThat(OperatingHoursResolver.windowFor(venue, DAY, DEFAULTS)).contains(DEFAULTS);
        assertThat(OperatingHoursResolver.windowFor(null, DAY, DEFAULTS)).contains(DEFAULTS);
    }

    @Test
    void weekdayHoursOverrideDefaults() {
        Venue venue = Venue.builder()
                .id("v")
                .operatingHours(Map.of(DayOfWeek.FRIDAY, OpeningHours.of("07:00", "23:00")))
                .build();

        assertThat(OperatingHoursResolver.windowFor(venue, DAY, DEFAULTS)).contains(new OperatingWindow(7 * 60, 23 * 60));
    }

    @Test
    void missingWeekdayMeansClosed() {
        Venue venue = Venue.builder()
                .id("v")
                .operatingHours(Map.of(DayOfWeek.MONDAY, OpeningHours.of("07:00", "23:00")))
                .build();

        assertThat(OperatingHoursResolver.windowFor(venue, DAY, DEFAULTS)).isEmpty();
    }

    @Test
    void midnightCloseRunsToEndOfDay() {
        Venue venue = Venue.builder()
                .id("v")
                .operatingHours(Map.of(DayOfWeek.FRIDAY, OpeningHours.of("18:00", "00:00")))
                .build();

        assertThat(OperatingHoursResolver.windowFor(venue, DAY, DEFAULTS)).contains(new OperatingWindow(18 * 60, 24 * 60));
    }
}
