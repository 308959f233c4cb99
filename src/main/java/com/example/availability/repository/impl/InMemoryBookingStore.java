package com.example.availability.repository.impl;

import com.example.availability.dto.BookingFilter;
import com.example.availability.model.Booking;
import com.example.availability.repository.BookingStore;
import com.example.availability.repository.Subscription;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

@Slf4j
@Component
public class InMemoryBookingStore implements BookingStore {

    private final Map<String, Booking> bookings = new ConcurrentHashMap<>();
    private final List<Watcher> watchers = new CopyOnWriteArrayList<>();

    @Override
    public Subscription subscribe(BookingFilter filter, Consumer<List<Booking>> onNext, Consumer<Throwable> onError) {
        Watcher watcher = new Watcher(filter, onNext, onError);
        watchers.add(watcher);
        emit(watcher);
        return () -> watchers.remove(watcher);
    }

    @Override
    public List<Booking> find(BookingFilter filter) {
        return bookings.values().stream()
                .filter(filter::matches)
                .toList();
    }

    public Booking save(Booking booking) {
        bookings.put(booking.getId(), booking);
        log.debug("Booking {} saved: court={}, {}-{}, status={}", booking.getId(), booking.getCourtId(),
                booking.getStartTime(), booking.getEndTime(), booking.getStatus());
        watchers.forEach(this::emit);
        return booking;
    }

    public void remove(String bookingId) {
        if (bookings.remove(bookingId) != null) {
            watchers.forEach(this::emit);
        }
    }

    private void emit(Watcher watcher) {
        List<Booking> matching;
        try {
            matching = find(watcher.filter());
        } catch (RuntimeException e) {
            log.error("Booking query failed for {}: {}", watcher.filter(), e.getMessage());
            watchers.remove(watcher);
            watcher.onError().accept(e);
            return;
        }
        watcher.onNext().accept(matching);
    }

    // identity equality: two subscriptions with the same filter are still distinct
    @Getter
    @Accessors(fluent = true)
    @RequiredArgsConstructor
    private static final class Watcher {
        private final BookingFilter filter;
        private final Consumer<List<Booking>> onNext;
        private final Consumer<Throwable> onError;
    }
}
