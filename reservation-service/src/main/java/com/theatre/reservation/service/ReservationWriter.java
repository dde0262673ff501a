package com.theatre.reservation.service;

import com.theatre.common.dto.ReservationDto;
import com.theatre.common.dto.TicketRequest;
import com.theatre.common.entity.Performance;
import com.theatre.common.entity.Reservation;
import com.theatre.common.entity.Ticket;
import com.theatre.reservation.repository.PerformanceRepository;
import com.theatre.reservation.repository.ReservationRepository;
import com.theatre.reservation.repository.TicketRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The single transaction that turns validated ticket requests into a reservation.
 * Either the reservation and every ticket commit together or nothing does.
 * Unique-constraint violations escape this class as Spring data access exceptions;
 * {@link ReservationService} translates them.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ReservationWriter {

    private final PerformanceRepository performanceRepository;
    private final ReservationRepository reservationRepository;
    private final TicketRepository ticketRepository;
    private final SeatValidator seatValidator;
    private final EventMessagingService messagingService;

    @Transactional
    public ReservationDto write(Long userId, List<TicketRequest> requests) {
        // 1. Resolve performances and validate seat bounds, first violation wins
        Map<Long, Performance> performances = loadPerformances(requests);

        for (TicketRequest request : requests) {
            Performance performance = performances.get(request.getPerformanceId());
            if (performance == null) {
                throw new PerformanceNotFoundException(request.getPerformanceId());
            }
            seatValidator.check(request.getRow(), request.getSeat(), performance.getTheatreHall())
                .ifPresent(violation -> {
                    throw new SeatOutOfRangeException(violation, performance.getId());
                });
        }

        // 2. Seats sold by already committed reservations; the unique constraint covers the rest
        for (TicketRequest request : requests) {
            if (ticketRepository.existsByPerformanceIdAndRowAndSeat(
                    request.getPerformanceId(), request.getRow(), request.getSeat())) {
                throw new SeatAlreadyTakenException(request.getPerformanceId(), request.getRow(), request.getSeat());
            }
        }

        // 3. Insert reservation and tickets, flushing so constraint violations surface here
        Reservation reservation = Reservation.builder()
            .userId(userId)
            .build();

        for (TicketRequest request : requests) {
            reservation.addTicket(Ticket.builder()
                .row(request.getRow())
                .seat(request.getSeat())
                .performance(performances.get(request.getPerformanceId()))
                .build());
        }

        reservation = reservationRepository.saveAndFlush(reservation);

        ReservationDto reservationDto = ReservationMapper.toCreatedDto(reservation);

        // 4. Kafka side-effect after the transaction completes
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status == STATUS_COMMITTED) {
                    messagingService.publishReservationCreated(reservationDto);
                } else {
                    log.warn("Reservation transaction for user={} did not commit (status={})", userId, status);
                }
            }
        });

        log.info("Reservation written: id={} user={} tickets={}",
                reservationDto.getId(), userId, reservationDto.getTicketCount());

        return reservationDto;
    }

    private Map<Long, Performance> loadPerformances(List<TicketRequest> requests) {
        List<Long> performanceIds = requests.stream()
            .map(TicketRequest::getPerformanceId)
            .distinct()
            .toList();

        return performanceRepository.findWithHallByIdIn(performanceIds).stream()
            .collect(Collectors.toMap(Performance::getId, Function.identity()));
    }
}
