package com.theatre.reservation.service;

import java.util.Map;

/**
 * Base class for failures surfaced to reservation callers.
 * Subclasses expose the structured context a client needs to render a precise message.
 */
public class ReservationException extends RuntimeException {

    public ReservationException(String message) {
        super(message);
    }

    public ReservationException(String message, Throwable cause) {
        super(message, cause);
    }

    public Map<String, Object> getDetails() {
        return Map.of();
    }
}
