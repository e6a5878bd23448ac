package com.ai.leasing.exception;

import com.ai.leasing.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ErrorResponse> invalidTransition(InvalidTransitionException e) {
        return body(HttpStatus.CONFLICT, e.getMessage(), e.getCurrentStage().code(), null);
    }

    @ExceptionHandler(SchedulingException.class)
    public ResponseEntity<ErrorResponse> scheduling(SchedulingException e) {
        return body(statusOf(e.getReason()), e.getMessage(), null, e.getReason().name());
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(NotFoundException e) {
        return body(HttpStatus.NOT_FOUND, e.getMessage(), null, null);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> badRequest(Exception e) {
        log.debug("Bad request: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, e.getMessage(), null, null);
    }

    static HttpStatus statusOf(SchedulingException.Reason reason) {
        switch (reason) {
            case INVALID_SLOT:
            case UNIT_NOT_FOUND:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            case UNIT_UNAVAILABLE:
            case INVALID_STATE:
                return HttpStatus.CONFLICT;
            case CALENDAR_TIMEOUT:
                return HttpStatus.GATEWAY_TIMEOUT;
            case CALENDAR_REJECTED:
            case CALENDAR_UNAVAILABLE:
            default:
                return HttpStatus.BAD_GATEWAY;
        }
    }

    private static ResponseEntity<ErrorResponse> body(HttpStatus status, String message, String stage, String reason) {
        return ResponseEntity.status(status)
                .body(new ErrorResponse(Instant.now(), status.value(), status.getReasonPhrase(), message, stage, reason));
    }
}
