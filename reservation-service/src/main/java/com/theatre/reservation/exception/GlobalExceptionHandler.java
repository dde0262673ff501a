package com.theatre.reservation.exception;

import com.theatre.common.dto.ErrorResponse;
import com.theatre.common.web.TraceIdFilter;
import com.theatre.reservation.service.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final String PATH = "/api/reservations";

    @ExceptionHandler(SeatAlreadyTakenException.class)
    public ResponseEntity<ErrorResponse> handleSeatAlreadyTaken(SeatAlreadyTakenException e) {
        log.warn("Seat already taken: performance={} row={} seat={}",
                e.getPerformanceId(), e.getRow(), e.getSeat());
        return build(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(SeatOutOfRangeException.class)
    public ResponseEntity<ErrorResponse> handleSeatOutOfRange(SeatOutOfRangeException e) {
        log.warn("Seat out of range: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(EmptyReservationException.class)
    public ResponseEntity<ErrorResponse> handleEmptyReservation(EmptyReservationException e) {
        log.warn("Empty reservation rejected");
        return build(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler({PerformanceNotFoundException.class, ReservationNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(ReservationException e) {
        log.warn("Not found: {}", e.getMessage());
        return build(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(StorageUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleStorageUnavailable(StorageUnavailableException e) {
        log.error("Storage unavailable: {}", e.getMessage(), e);
        return build(HttpStatus.SERVICE_UNAVAILABLE, e);
    }

    @ExceptionHandler(ReservationException.class)
    public ResponseEntity<ErrorResponse> handleReservationException(ReservationException e) {
        log.warn("Reservation error: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        Map<String, String> fieldErrors = new HashMap<>();

        for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
            fieldErrors.put(fieldError.getField(), fieldError.getDefaultMessage());
        }

        ErrorResponse errorResponse = ErrorResponse.builder()
            .timestamp(LocalDateTime.now())
            .status(HttpStatus.BAD_REQUEST.value())
            .error("Validation Failed")
            .message("Invalid request parameters")
            .path(PATH)
            .validationErrors(fieldErrors)
            .traceId(TraceIdFilter.currentTraceId())
            .build();

        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
                       MissingServletRequestParameterException.class,
                       MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());

        ErrorResponse errorResponse = ErrorResponse.builder()
            .timestamp(LocalDateTime.now())
            .status(HttpStatus.BAD_REQUEST.value())
            .error(HttpStatus.BAD_REQUEST.getReasonPhrase())
            .message("Malformed request")
            .path(PATH)
            .traceId(TraceIdFilter.currentTraceId())
            .build();

        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error in reservation service", e);

        ErrorResponse errorResponse = ErrorResponse.builder()
            .timestamp(LocalDateTime.now())
            .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
            .error("Internal Server Error")
            .message("An unexpected error occurred. Please try again later.")
            .path(PATH)
            .traceId(TraceIdFilter.currentTraceId())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, ReservationException e) {
        Map<String, Object> details = e.getDetails();

        ErrorResponse errorResponse = ErrorResponse.builder()
            .timestamp(LocalDateTime.now())
            .status(status.value())
            .error(status.getReasonPhrase())
            .message(e.getMessage())
            .path(PATH)
            .details(details.isEmpty() ? null : details)
            .traceId(TraceIdFilter.currentTraceId())
            .build();

        return ResponseEntity.status(status).body(errorResponse);
    }
}
