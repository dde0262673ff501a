package com.theatre.reservation.service;

import com.theatre.common.dto.ReservationDto;

/**
 * Publishes reservation lifecycle events. Called only after the reservation
 * transaction has committed; implementations must not throw.
 */
public interface EventMessagingService {

    void publishReservationCreated(ReservationDto reservation);
}
