package com.example.availability.dto;

public record TimeSlotOption(String label, int value, boolean available) {

    public TimeSlotOption withAvailable(boolean flag) {
        return flag == available ? this : new TimeSlotOption(label, value, flag);
    }
}
