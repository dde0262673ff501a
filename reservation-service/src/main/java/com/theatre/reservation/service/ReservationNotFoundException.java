package com.theatre.reservation.service;

public class ReservationNotFoundException extends ReservationException {

    public ReservationNotFoundException(String message) {
        super(message);
    }
}
