package com.example.availability.service.exception;

public class VenueNotFoundException extends RuntimeException {

    public VenueNotFoundException(String venueId) {
        super("Venue not found: " + venueId);
    }
}
