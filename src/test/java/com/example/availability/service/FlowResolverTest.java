package com.example.availability.service;

import com.example.availability.model.BookingFlowType;
import com.example.availability.model.Venue;
import com.example.availability.model.VenueSettings;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FlowResolverTest {

    private final FlowResolver resolver = new FlowResolver();

    @Test
    void usesSupportedFlowFromSettings() {
        Venue venue = venueWithFlow("date_time_duration_court");

        assertThat(resolver.resolve(venue)).isEqualTo(BookingFlowType.DATE_TIME_DURATION_COURT);
    }

    @Test
    void fallsBackToDefault() {
        assertThat(resolver.resolve(null)).isEqualTo(BookingFlowType.DEFAULT);
        assertThat(resolver.resolve(Venue.builder().id("v").build())).isEqualTo(BookingFlowType.DEFAULT);
        assertThat(resolver.resolve(venueWithFlow(""))).isEqualTo(BookingFlowType.DEFAULT);
        assertThat(resolver.resolve(venueWithFlow("court_first"))).isEqualTo(BookingFlowType.DEFAULT);
    }

    private static Venue venueWithFlow(String flow) {
        return Venue.builder()
                .id("v")
                .settings(VenueSettings.builder().bookingFlow(flow).build())
                .build();
    }
}
