package com.ai.leasing.exception;

import lombok.Getter;

/**
 * Tour booking failed. Thrown inside the booking transaction so nothing of the
 * attempt is kept.
 */
@Getter
public class SchedulingException extends RuntimeException {

    public enum Reason {
        INVALID_SLOT,
        UNIT_NOT_FOUND,
        UNIT_UNAVAILABLE,
        INVALID_STATE,
        CALENDAR_REJECTED,
        CALENDAR_UNAVAILABLE,
        CALENDAR_TIMEOUT
    }

    private final Reason reason;

    public SchedulingException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public SchedulingException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
