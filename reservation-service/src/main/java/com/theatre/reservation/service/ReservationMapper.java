package com.theatre.reservation.service;

import com.theatre.common.dto.PerformanceListDto;
import com.theatre.common.dto.ReservationDto;
import com.theatre.common.dto.TicketDto;
import com.theatre.common.entity.Performance;
import com.theatre.common.entity.Reservation;
import com.theatre.common.entity.Ticket;

import java.util.Comparator;
import java.util.List;

/**
 * Output shapes for reservations. The creation response carries bare performance ids,
 * the list and detail views embed a performance summary per ticket.
 */
final class ReservationMapper {

    private static final Comparator<Ticket> SEAT_ORDER =
        Comparator.comparing(Ticket::getRow).thenComparing(Ticket::getSeat);

    private ReservationMapper() {
    }

    static ReservationDto toCreatedDto(Reservation reservation) {
        return toDto(reservation, ticketsOf(reservation).stream()
            .map(ticket -> TicketDto.builder()
                .id(ticket.getId())
                .row(ticket.getRow())
                .seat(ticket.getSeat())
                .performanceId(ticket.getPerformance().getId())
                .build())
            .toList());
    }

    static ReservationDto toListDto(Reservation reservation) {
        return toDto(reservation, ticketsOf(reservation).stream()
            .map(ticket -> TicketDto.builder()
                .id(ticket.getId())
                .row(ticket.getRow())
                .seat(ticket.getSeat())
                .performanceId(ticket.getPerformance().getId())
                .performance(toPerformanceSummary(ticket.getPerformance()))
                .build())
            .toList());
    }

    private static ReservationDto toDto(Reservation reservation, List<TicketDto> tickets) {
        return ReservationDto.builder()
            .id(reservation.getId())
            .userId(reservation.getUserId())
            .createdAt(reservation.getCreatedAt())
            .tickets(tickets)
            .build();
    }

    private static List<Ticket> ticketsOf(Reservation reservation) {
        return reservation.getTickets().stream()
            .sorted(SEAT_ORDER)
            .toList();
    }

    private static PerformanceListDto toPerformanceSummary(Performance performance) {
        return PerformanceListDto.builder()
            .id(performance.getId())
            .showTime(performance.getShowTime())
            .playTitle(performance.getPlay().getTitle())
            .theatreHallName(performance.getTheatreHall().getName())
            .theatreHallCapacity(performance.getTheatreHall().getCapacity())
            .build();
    }
}
