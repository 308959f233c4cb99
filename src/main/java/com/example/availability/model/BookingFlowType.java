package com.example.availability.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static com.example.availability.model.BookingStep.COURT;
import static com.example.availability.model.BookingStep.DATE;
import static com.example.availability.model.BookingStep.DURATION;
import static com.example.availability.model.BookingStep.PAYMENT;
import static com.example.availability.model.BookingStep.TIME;

/**
 * The fixed orderings of the booking wizard. Adding an ordering means adding a constant here.
 */
public enum BookingFlowType {

    DATE_COURT_TIME_DURATION("date_court_time_duration", DATE, COURT, TIME, DURATION, PAYMENT),
    DATE_TIME_DURATION_COURT("date_time_duration_court", DATE, TIME, DURATION, COURT, PAYMENT),
    DATE_TIME_COURT_DURATION("date_time_court_duration", DATE, TIME, COURT, DURATION, PAYMENT);

    public static final BookingFlowType DEFAULT = DATE_COURT_TIME_DURATION;

    private final String id;
    private final List<BookingStep> steps;

    BookingFlowType(String id, BookingStep... steps) {
        this.id = id;
        this.steps = List.of(steps);
    }

    public String id() {
        return id;
    }

    public List<BookingStep> steps() {
        return steps;
    }

    /** 1-based position of the step in this flow. */
    public int stepNumber(BookingStep step) {
        return steps.indexOf(step) + 1;
    }

    public Optional<BookingStep> nextStep(BookingStep current) {
        int index = steps.indexOf(current);
        if (index < 0 || index == steps.size() - 1) {
            return Optional.empty();
        }
        return Optional.of(steps.get(index + 1));
    }

    /** Accepts the stored identifier or the constant name, case-insensitive. */
    public static Optional<BookingFlowType> fromId(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim();
        return Arrays.stream(values())
                .filter(type -> type.id.equalsIgnoreCase(normalized) || type.name().equalsIgnoreCase(normalized))
                .findFirst();
    }
}
