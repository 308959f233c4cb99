package com.example.availability.service;

import com.example.availability.dto.AvailabilitySnapshot;
import com.example.availability.dto.BookingFilter;
import com.example.availability.dto.BookingSelection;
import com.example.availability.dto.TimeSlot;
import com.example.availability.model.Booking;
import com.example.availability.model.BookingFlowType;
import com.example.availability.repository.BookingStore;
import com.example.availability.repository.CourtRegistry;
import com.example.availability.repository.Subscription;
import com.example.availability.repository.VenueRegistry;
import com.example.availability.service.AvailabilityEngine.PreparedDay;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Availability state of one booking session. {@link #recompute()} is the only writer; each run bumps
 * the generation, so booking emissions from a superseded subscription are dropped.
 */
@Slf4j
public class SchedulerState implements AutoCloseable {

    @Getter
    private final String sessionId;
    private final AvailabilityEngine engine;
    private final CourtRegistry courtRegistry;
    private final VenueRegistry venueRegistry;
    private final BookingStore bookingStore;

    private final AtomicReference<AvailabilitySnapshot> snapshot = new AtomicReference<>(AvailabilitySnapshot.initial());
    private final AtomicLong generation = new AtomicLong();
    private final List<Consumer<AvailabilitySnapshot>> listeners = new CopyOnWriteArrayList<>();
    private final List<Subscription> upstream = new CopyOnWriteArrayList<>();

    // flow is fixed per venue for the lifetime of the session
    private final Map<String, BookingFlowType> flowsByVenue = new ConcurrentHashMap<>();

    private volatile BookingSelection selection = BookingSelection.empty();
    private volatile boolean closed;

    // guarded by this
    private Subscription bookingSubscription = Subscription.NONE;

    SchedulerState(String sessionId,
                   AvailabilityEngine engine,
                   CourtRegistry courtRegistry,
                   VenueRegistry venueRegistry,
                   BookingStore bookingStore) {
        this.sessionId = sessionId;
        this.engine = engine;
        this.courtRegistry = courtRegistry;
        this.venueRegistry = venueRegistry;
        this.bookingStore = bookingStore;
    }

    void start() {
        upstream.add(courtRegistry.onChange(this::recompute));
        upstream.add(venueRegistry.onChange(this::recompute));
    }

    public AvailabilitySnapshot snapshot() {
        return snapshot.get();
    }

    public BookingSelection selection() {
        return selection;
    }

    public boolean isClosed() {
        return closed;
    }

    /** Picks the day to show. Court and time choices are cleared when the day changes. */
    public void select(LocalDate date, String venueId) {
        BookingSelection current = selection;
        if (current.sameDay(BookingSelection.builder().date(date).venueId(venueId).build())) {
            return;
        }
        updateSelection(current.toBuilder()
                .date(date)
                .venueId(venueId)
                .courtId(null)
                .startTime(null)
                .endTime(null)
                .build());
    }

    public void updateSelection(BookingSelection next) {
        BookingSelection previous = selection;
        selection = next == null ? BookingSelection.empty() : next;
        if (!selection.sameDay(previous)) {
            recompute();
        }
    }

    public Subscription addListener(Consumer<AvailabilitySnapshot> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public synchronized void recompute() {
        if (closed) {
            return;
        }
        long current = generation.incrementAndGet();
        bookingSubscription.unsubscribe();
        bookingSubscription = Subscription.NONE;

        BookingSelection target = selection;
        if (!target.isComplete()) {
            publish(AvailabilitySnapshot.initial());
            return;
        }
        String venueId = target.venueId();
        LocalDate date = target.date();
        BookingFlowType flowType = flowsByVenue.computeIfAbsent(venueId, engine::resolveFlow);

        AvailabilitySnapshot previous = snapshot.get();
        publish(previous.isFor(date, venueId)
                ? previous.toLoading()
                : new AvailabilitySnapshot(date, venueId, null, List.of(), List.of(), List.of(), flowType, true, null));

        PreparedDay day = engine.prepare(venueId, date);
        if (day.activeCourtIds().isEmpty()) {
            log.info("Session {}: no active courts for venue {}", sessionId, venueId);
            publish(AvailabilitySnapshot.noActiveCourts(date, venueId, day.venueName(), flowType));
            return;
        }

        try {
            bookingSubscription = bookingStore.subscribe(BookingFilter.active(date, venueId),
                    bookings -> onBookings(current, day, flowType, bookings),
                    error -> onBookingsFailed(current, day, flowType, error));
        } catch (RuntimeException e) {
            onBookingsFailed(current, day, flowType, e);
        }
    }

    private synchronized void onBookings(long expected, PreparedDay day, BookingFlowType flowType, List<Booking> bookings) {
        if (closed || expected != generation.get()) {
            log.debug("Session {}: dropped stale booking emission", sessionId);
            return;
        }
        AvailabilitySnapshot next = engine.occupy(day, bookings, flowType);
        publish(next);
        log.debug("Session {}: published {} slots for venue {} on {}", sessionId, next.timeSlots().size(),
                day.venueId(), day.date());
    }

    private synchronized void onBookingsFailed(long expected, PreparedDay day, BookingFlowType flowType, Throwable error) {
        if (closed || expected != generation.get()) {
            return;
        }
        log.error("Session {}: booking subscription failed for venue {} on {}", sessionId, day.venueId(), day.date(), error);

        AvailabilitySnapshot previous = snapshot.get();
        boolean sameDay = previous.isFor(day.date(), day.venueId()) && !previous.timeSlots().isEmpty();
        List<TimeSlot> slots = sameDay ? previous.timeSlots() : day.skeleton();
        List<Booking> bookings = sameDay ? previous.bookings() : List.of();

        publish(new AvailabilitySnapshot(day.date(), day.venueId(), day.venueName(), slots, day.activeCourtIds(),
                bookings, flowType, false, AvailabilitySnapshot.LOAD_FAILED));
    }

    private void publish(AvailabilitySnapshot next) {
        snapshot.set(next);
        for (Consumer<AvailabilitySnapshot> listener : listeners) {
            try {
                listener.accept(next);
            } catch (RuntimeException e) {
                log.warn("Session {}: snapshot listener failed: {}", sessionId, e.getMessage());
            }
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        generation.incrementAndGet();
        bookingSubscription.unsubscribe();
        bookingSubscription = Subscription.NONE;
        upstream.forEach(Subscription::unsubscribe);
        upstream.clear();
        listeners.clear();
        log.info("Availability session {} closed", sessionId);
    }
}
