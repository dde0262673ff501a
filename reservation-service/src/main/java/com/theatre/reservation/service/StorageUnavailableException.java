package com.theatre.reservation.service;

/**
 * The reservation could not be attempted or its outcome could not be determined.
 * Nothing was committed, so the same request is safe to retry.
 */
public class StorageUnavailableException extends ReservationException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
