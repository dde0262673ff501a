package com.theatre.reservation.service;

public class EmptyReservationException extends ReservationException {

    public EmptyReservationException() {
        super("A reservation must contain at least one ticket");
    }
}
