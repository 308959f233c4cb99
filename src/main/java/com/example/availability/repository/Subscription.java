package com.example.availability.repository;

/**
 * Handle returned by every reactive collaborator; unsubscribing twice is harmless.
 */
@FunctionalInterface
public interface Subscription {

    Subscription NONE = () -> {
    };

    void unsubscribe();
}
