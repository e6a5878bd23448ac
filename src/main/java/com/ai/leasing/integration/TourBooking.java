package com.ai.leasing.integration;

import java.time.Instant;

/**
 * Slot and attendee sent to the external calendar.
 */
public record TourBooking(Instant start, int durationMinutes, Attendee attendee, String location, String title) {

    public record Attendee(String name, String email, String phone) {
    }

    public Instant end() {
        return start.plusSeconds(durationMinutes * 60L);
    }
}
