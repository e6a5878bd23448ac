package com.ai.leasing.exception;

import com.ai.leasing.dto.ErrorResponse;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class ApiExceptionHandlerTest {

    @Test
    void badInputIsUnprocessable() {
        assertThat(ApiExceptionHandler.statusOf(SchedulingException.Reason.INVALID_SLOT))
                .isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(ApiExceptionHandler.statusOf(SchedulingException.Reason.UNIT_NOT_FOUND))
                .isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @Test
    void stateClashIsConflict() {
        assertThat(ApiExceptionHandler.statusOf(SchedulingException.Reason.UNIT_UNAVAILABLE))
                .isEqualTo(HttpStatus.CONFLICT);
        assertThat(ApiExceptionHandler.statusOf(SchedulingException.Reason.INVALID_STATE))
                .isEqualTo(HttpStatus.CONFLICT);
    }

    @Test
    void calendarFailuresAreGatewayErrors() {
        assertThat(ApiExceptionHandler.statusOf(SchedulingException.Reason.CALENDAR_TIMEOUT))
                .isEqualTo(HttpStatus.GATEWAY_TIMEOUT);
        assertThat(ApiExceptionHandler.statusOf(SchedulingException.Reason.CALENDAR_REJECTED))
                .isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(ApiExceptionHandler.statusOf(SchedulingException.Reason.CALENDAR_UNAVAILABLE))
                .isEqualTo(HttpStatus.BAD_GATEWAY);
    }

    @Test
    void schedulingErrorBodyCarriesReason() {
        ResponseEntity<ErrorResponse> response = new ApiExceptionHandler().scheduling(
                new SchedulingException(SchedulingException.Reason.INVALID_SLOT, "Slot is in the past"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(response.getBody().getReason()).isEqualTo("INVALID_SLOT");
        assertThat(response.getBody().getStatus()).isEqualTo(422);
    }
}
