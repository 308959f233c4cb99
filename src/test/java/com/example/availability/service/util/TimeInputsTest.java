package com.example.availability.service.util;

import org.junit.jupiter.api.Test;

import java.time.ZonedDateTime;

import static com.example.availability.Fixtures.DAY;
import static com.example.availability.Fixtures.ZONE;
import static org.assertj.core.api.Assertions.assertThat;

class TimeInputsTest {

    @Test
    void parsesOffsetLocalAndLabelForms() {
        ZonedDateTime expected = DAY.atTime(10, 0).atZone(ZONE);

        assertThat(TimeInputs.parseDateTime("2026-10-16T08:00:00Z", DAY, ZONE)).contains(expected);
        assertThat(TimeInputs.parseDateTime("2026-10-16T10:00:00+02:00", DAY, ZONE)).contains(expected);
        assertThat(TimeInputs.parseDateTime("2026-10-16T10:00", DAY, ZONE)).contains(expected);
        assertThat(TimeInputs.parseDateTime("10:00", DAY, ZONE)).contains(expected);
    }

    @Test
    void rejectsGarbageAndBareTimeWithoutDate() {
        assertThat(TimeInputs.parseDateTime("tomorrow", DAY, ZONE)).isEmpty();
        assertThat(TimeInputs.parseDateTime("2026-13-40T10:00", DAY, ZONE)).isEmpty();
        assertThat(TimeInputs.parseDateTime("", DAY, ZONE)).isEmpty();
        assertThat(TimeInputs.parseDateTime("10:00", null, ZONE)).isEmpty();
    }

    @Test
    void minutesAreClampedToTheDay() {
        assertThat(TimeInputs.minutesOnDate(DAY.atTime(9, 30).atZone(ZONE), DAY)).isEqualTo(570);
        assertThat(TimeInputs.minutesOnDate(DAY.minusDays(1).atTime(23, 0).atZone(ZONE), DAY)).isZero();
        assertThat(TimeInputs.minutesOnDate(DAY.plusDays(1).atTime(1, 0).atZone(ZONE), DAY)).isEqualTo(1440);
    }

    @Test
    void labelsAndSubSlots() {
        assertThat(TimeInputs.label(510)).isEqualTo("08:30");
        assertThat(TimeInputs.subSlots(600, 90)).containsExactly(600, 630, 660);
    }
}
