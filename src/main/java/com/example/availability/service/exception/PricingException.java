package com.example.availability.service.exception;

public class PricingException extends RuntimeException {

    public PricingException(String message) {
        super(message);
    }
}
