package com.example.availability.service.util;

import com.example.availability.dto.OperatingWindow;
import com.example.availability.dto.TimeSlot;
import com.example.availability.model.Booking;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.example.availability.Fixtures.DAY;
import static com.example.availability.Fixtures.ZONE;
import static com.example.availability.Fixtures.booking;
import static org.assertj.core.api.Assertions.assertThat;

class BookingOccupancyMapperTest {

    private final List<TimeSlot> skeleton =
            SlotGenerator.generate(DAY, new OperatingWindow(8 * 60, 22 * 60), List.of("Court-1", "Court-2"), null);

    @Test
    void bookingMarksHalfOpenRangeForItsCourtOnly() {
        List<TimeSlot> slots = BookingOccupancyMapper.apply(skeleton,
                List.of(booking("b1", "Court-1", "10:00", "11:00")), DAY, ZONE);

        assertThat(slot(slots, "10:00").courtAvailability()).containsEntry("Court-1", false).containsEntry("Court-2", true);
        assertThat(slot(slots, "10:30").courtAvailability()).containsEntry("Court-1", false);
        assertThat(slot(slots, "10:30").hasAvailableCourts()).isTrue();
        assertThat(slot(slots, "11:00").courtAvailability()).containsEntry("Court-1", true);
        assertThat(slot(slots, "09:30").courtAvailability()).containsEntry("Court-1", true);
    }

    @Test
    void slotWithAllCourtsTakenHasNoAvailability() {
        List<TimeSlot> slots = BookingOccupancyMapper.apply(skeleton, List.of(
                booking("b1", "Court-1", "10:00", "10:30"),
                booking("b2", "Court-2", "10:00", "10:30")), DAY, ZONE);

        assertThat(slot(slots, "10:00").hasAvailableCourts()).isFalse();
        assertThat(slot(slots, "10:30").hasAvailableCourts()).isTrue();
    }

    @Test
    void inactiveWrongDayUnknownCourtAndBrokenBookingsAreIgnored() {
        Booking cancelled = booking("b1", "Court-1", "10:00", "11:00");
        cancelled.setStatus(Booking.BookingStatus.CANCELLED);
        Booking completed = booking("b2", "Court-1", "12:00", "13:00");
        completed.setStatus(Booking.BookingStatus.COMPLETED);
        Booking otherDay = booking("b3", "Court-1", "14:00", "15:00");
        otherDay.setDate(DAY.plusDays(1));
        Booking retiredCourt = booking("b4", "Court-9", "16:00", "17:00");
        Booking broken = booking("b5", "Court-1", "18:00", "19:00");
        broken.setStartTime("not-a-time");

        List<TimeSlot> slots = BookingOccupancyMapper.apply(skeleton,
                List.of(cancelled, completed, otherDay, retiredCourt, broken), DAY, ZONE);

        assertThat(slots).isEqualTo(skeleton);
    }

    @Test
    void holdingAndPendingBookingsOccupy() {
        Booking holding = booking("b1", "Court-1", "10:00", "10:30");
        holding.setStatus(Booking.BookingStatus.HOLDING);
        Booking pending = booking("b2", "Court-2", "10:00", "10:30");
        pending.setStatus(Booking.BookingStatus.PENDING);

        List<TimeSlot> slots = BookingOccupancyMapper.apply(skeleton, List.of(holding, pending), DAY, ZONE);

        assertThat(slot(slots, "10:00").hasAvailableCourts()).isFalse();
    }

    @Test
    void offsetTimesAreConvertedToVenueZone() {
        Booking utc = booking("b1", "Court-1", "00:00", "00:00");
        utc.setStartTime("2026-10-16T08:00:00Z");
        utc.setEndTime("2026-10-16T09:00:00Z");

        List<TimeSlot> slots = BookingOccupancyMapper.apply(skeleton, List.of(utc), DAY, ZONE);

        assertThat(slot(slots, "10:00").isAvailable("Court-1")).isFalse();
        assertThat(slot(slots, "10:30").isAvailable("Court-1")).isFalse();
        assertThat(slot(slots, "08:00").isAvailable("Court-1")).isTrue();
    }

    @Test
    void bookingStartingPreviousDayCoversMorning() {
        Booking overnight = booking("b1", "Court-2", "00:00", "00:00");
        overnight.setDate(null);
        overnight.setStartTime("2026-10-15T23:00:00");
        overnight.setEndTime("2026-10-16T09:00:00");

        List<TimeSlot> slots = BookingOccupancyMapper.apply(skeleton, List.of(overnight), DAY, ZONE);

        assertThat(slot(slots, "08:00").isAvailable("Court-2")).isFalse();
        assertThat(slot(slots, "08:30").isAvailable("Court-2")).isFalse();
        assertThat(slot(slots, "09:00").isAvailable("Court-2")).isTrue();
    }

    @Test
    void resultIsIdempotentAndOrderIndependent() {
        List<Booking> bookings = new ArrayList<>(List.of(
                booking("b1", "Court-1", "10:00", "11:00"),
                booking("b2", "Court-1", "10:30", "12:00"),
                booking("b3", "Court-2", "08:00", "09:00")));

        List<TimeSlot> first = BookingOccupancyMapper.apply(skeleton, bookings, DAY, ZONE);
        List<TimeSlot> second = BookingOccupancyMapper.apply(skeleton, bookings, DAY, ZONE);
        Collections.reverse(bookings);
        List<TimeSlot> reversed = BookingOccupancyMapper.apply(skeleton, bookings, DAY, ZONE);

        assertThat(second).isEqualTo(first);
        assertThat(reversed).isEqualTo(first);
        assertThat(skeleton).allMatch(slot -> slot.isAvailable("Court-1") && slot.isAvailable("Court-2"));
    }

    private static TimeSlot slot(List<TimeSlot> slots, String time) {
        return slots.stream().filter(s -> s.time().equals(time)).findFirst().orElseThrow();
    }
}
