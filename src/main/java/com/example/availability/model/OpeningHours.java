package com.example.availability.model;

import java.time.LocalTime;

public record OpeningHours(LocalTime open, LocalTime close) {

    public static OpeningHours of(String open, String close) {
        return new OpeningHours(LocalTime.parse(open), LocalTime.parse(close));
    }
}
