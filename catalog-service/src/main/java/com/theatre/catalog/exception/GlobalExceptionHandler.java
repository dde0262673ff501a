package com.theatre.catalog.exception;

import com.theatre.catalog.service.CatalogException;
import com.theatre.catalog.service.DuplicateResourceException;
import com.theatre.catalog.service.HallChangeConflictException;
import com.theatre.catalog.service.ResourceNotFoundException;
import com.theatre.common.dto.ErrorResponse;
import com.theatre.common.web.TraceIdFilter;
import jakarta.servlet.http.HttpServletRequest;
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

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException e, HttpServletRequest request) {
        log.warn("Not found: {}", e.getMessage());
        return build(HttpStatus.NOT_FOUND, e, request);
    }

    @ExceptionHandler(DuplicateResourceException.class)
    public ResponseEntity<ErrorResponse> handleDuplicate(DuplicateResourceException e, HttpServletRequest request) {
        log.warn("Duplicate resource: {}", e.getMessage());
        return build(HttpStatus.CONFLICT, e, request);
    }

    @ExceptionHandler(HallChangeConflictException.class)
    public ResponseEntity<ErrorResponse> handleHallChangeConflict(HallChangeConflictException e,
                                                                  HttpServletRequest request) {
        log.warn("Hall change refused: {}", e.getMessage());
        return build(HttpStatus.CONFLICT, e, request);
    }

    @ExceptionHandler(CatalogException.class)
    public ResponseEntity<ErrorResponse> handleCatalogException(CatalogException e, HttpServletRequest request) {
        log.warn("Catalog error: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, e, request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e,
                                                                   HttpServletRequest request) {
        Map<String, String> fieldErrors = new HashMap<>();

        for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
            fieldErrors.put(fieldError.getField(), fieldError.getDefaultMessage());
        }

        ErrorResponse errorResponse = ErrorResponse.builder()
            .timestamp(LocalDateTime.now())
            .status(HttpStatus.BAD_REQUEST.value())
            .error("Validation Failed")
            .message("Invalid request parameters")
            .path(request.getRequestURI())
            .validationErrors(fieldErrors)
            .traceId(TraceIdFilter.currentTraceId())
            .build();

        return ResponseEntity.badRequest().body(errorResponse);
    }

    // Covers filters such as genres=1,x and dates that do not parse
    @ExceptionHandler({HttpMessageNotReadableException.class,
                       MissingServletRequestParameterException.class,
                       MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception e, HttpServletRequest request) {
        log.warn("Malformed request to {}: {}", request.getRequestURI(), e.getMessage());

        ErrorResponse errorResponse = ErrorResponse.builder()
            .timestamp(LocalDateTime.now())
            .status(HttpStatus.BAD_REQUEST.value())
            .error(HttpStatus.BAD_REQUEST.getReasonPhrase())
            .message("Malformed request")
            .path(request.getRequestURI())
            .traceId(TraceIdFilter.currentTraceId())
            .build();

        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e, HttpServletRequest request) {
        log.error("Unexpected error in catalog service", e);

        ErrorResponse errorResponse = ErrorResponse.builder()
            .timestamp(LocalDateTime.now())
            .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
            .error("Internal Server Error")
            .message("An unexpected error occurred. Please try again later.")
            .path(request.getRequestURI())
            .traceId(TraceIdFilter.currentTraceId())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, CatalogException e, HttpServletRequest request) {
        Map<String, Object> details = e.getDetails();

        ErrorResponse errorResponse = ErrorResponse.builder()
            .timestamp(LocalDateTime.now())
            .status(status.value())
            .error(status.getReasonPhrase())
            .message(e.getMessage())
            .path(request.getRequestURI())
            .details(details.isEmpty() ? null : details)
            .traceId(TraceIdFilter.currentTraceId())
            .build();

        return ResponseEntity.status(status).body(errorResponse);
    }
}
