package com.example.availability.dto;

import com.example.availability.model.BookingFlowType;

import java.util.List;
import java.util.stream.IntStream;

public record FlowView(String venueId, String flowType, List<Step> steps) {

    public static FlowView of(String venueId, BookingFlowType type) {
        List<Step> steps = IntStream.range(0, type.steps().size())
                .mapToObj(i -> new Step(i + 1, type.steps().get(i).label()))
                .toList();
        return new FlowView(venueId, type.id(), steps);
    }

    public record Step(int step, String label) {}
}
