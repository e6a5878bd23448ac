package com.ai.leasing.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

@Getter
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private final Instant timestamp;
    private final int status;
    private final String error;
    private final String message;
    /** Current lead stage, for rejected events. */
    private final String stage;
    /** Scheduling failure reason, for rejected bookings. */
    private final String reason;
}
