package com.ai.leasing.integration;

import lombok.Getter;

@Getter
public class CalendarException extends Exception {

    public enum Kind {
        /** The calendar answered and refused the request. */
        REJECTED,
        /** Not reachable or failed on its side. */
        UNAVAILABLE,
        TIMEOUT
    }

    private final Kind kind;

    public CalendarException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CalendarException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public boolean isTransient() {
        return kind != Kind.REJECTED;
    }
}
