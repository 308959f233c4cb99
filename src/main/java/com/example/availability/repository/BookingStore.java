package com.example.availability.repository;

import com.example.availability.dto.BookingFilter;
import com.example.availability.model.Booking;

import java.util.List;
import java.util.function.Consumer;

public interface BookingStore {

    /**
     * Emits the full matching set on subscribe and again after every change; never a delta.
     * Errors are delivered to {@code onError} and end the subscription.
     */
    Subscription subscribe(BookingFilter filter, Consumer<List<Booking>> onNext, Consumer<Throwable> onError);

    /** One-shot read of the current matching set. */
    List<Booking> find(BookingFilter filter);
}
