package com.example.availability.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Set;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Booking {

    private String id;
    private String courtId;
    private String venueId;
    private String userId;

    private LocalDate date;

    /** ISO-8601 date-time as stored by the booking store, with or without offset */
    private String startTime;
    private String endTime;

    @Builder.Default
    private BookingStatus status = BookingStatus.PENDING;

    public boolean isOccupying() {
        return status != null && status.isActive();
    }

    public enum BookingStatus {
        PENDING, HOLDING, CONFIRMED, CANCELLED, COMPLETED;

        public static final Set<BookingStatus> ACTIVE = EnumSet.of(PENDING, HOLDING, CONFIRMED);

        public boolean isActive() {
            return ACTIVE.contains(this);
        }
    }
}
