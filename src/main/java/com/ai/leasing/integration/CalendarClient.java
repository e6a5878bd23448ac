package com.ai.leasing.integration;

/**
 * External calendar that owns tour events. Calls must return or fail within the
 * configured timeouts.
 */
public interface CalendarClient {

    /** @return the calendar's id for the new event */
    String createEvent(TourBooking booking) throws CalendarException;

    void cancelEvent(String externalEventId, String reason) throws CalendarException;
}
