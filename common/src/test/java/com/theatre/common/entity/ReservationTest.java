package com.theatre.common.entity;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReservationTest {

    @Test
    void addTicket_LinksBothSides() {
        Reservation reservation = Reservation.builder().userId(7L).build();
        Ticket ticket = Ticket.builder().row(2).seat(3).build();

        reservation.addTicket(ticket);

        assertSame(reservation, ticket.getReservation());
        assertEquals(1, reservation.getTicketCount());
    }

    @Test
    void newReservation_HasNoTickets() {
        Reservation reservation = new Reservation();

        assertNotNull(reservation.getTickets());
        assertEquals(0, reservation.getTicketCount());
    }

    @Test
    void artistFullName_JoinsFirstAndLast() {
        Artist artist = Artist.builder().firstName("Ivan").lastName("Franko").build();

        assertEquals("Ivan Franko", artist.getFullName());
    }
}
