package com.example.availability.service.exception;

public class InvalidTimeInputException extends RuntimeException {

    public InvalidTimeInputException(String message) {
        super(message);
    }

    public InvalidTimeInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
