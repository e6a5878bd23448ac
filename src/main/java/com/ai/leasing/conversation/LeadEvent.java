package com.ai.leasing.conversation;

import com.ai.leasing.matching.NoMatchReason;

import java.time.LocalDate;

/**
 * Structured inbound events. Free text is classified upstream; by the time an
 * event reaches the state machine it is one of these.
 */
public interface LeadEvent {

    record ContactStarted() implements LeadEvent {
    }

    record PayslipsAnswered(boolean hasPayslips) implements LeadEvent {
    }

    record DepositAnswered(boolean canPayDeposit) implements LeadEvent {
    }

    record MoveInDateAnswered(LocalDate moveInDate) implements LeadEvent {
    }

    /** Partial profile; fields listed in {@code update.skipped()} were declined by the lead. */
    record ProfileProvided(LeadProfile update) implements LeadEvent {
    }

    record NoUnitsMatched(NoMatchReason reason) implements LeadEvent {
    }

    record TourRequested() implements LeadEvent {
    }

    record TourBooked() implements LeadEvent {
        @Override
        public boolean isSystem() {
            return true;
        }
    }

    record TourBookingFailed(String reason) implements LeadEvent {
        @Override
        public boolean isSystem() {
            return true;
        }
    }

    default String type() {
        return getClass().getSimpleName();
    }

    /** Raised by the booking flow rather than by a message from the lead. */
    default boolean isSystem() {
        return false;
    }
}
