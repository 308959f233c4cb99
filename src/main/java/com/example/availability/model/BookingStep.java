package com.example.availability.model;

public enum BookingStep {
    DATE("Date"),
    COURT("Court"),
    TIME("Time"),
    DURATION("Duration"),
    PAYMENT("Payment");

    private final String label;

    BookingStep(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
