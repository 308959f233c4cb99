package com.example.availability.dto;

/**
 * Bookable window of a day in minutes since midnight, {@code [openMinutes, closeMinutes)}.
 */
public record OperatingWindow(int openMinutes, int closeMinutes) {

    public boolean isEmpty() {
        return closeMinutes <= openMinutes;
    }
}
