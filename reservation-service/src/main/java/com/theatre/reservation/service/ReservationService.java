package com.theatre.reservation.service;

import com.theatre.common.dto.ReservationDto;
import com.theatre.common.dto.ReservationRequest;
import com.theatre.common.dto.TicketRequest;
import com.theatre.common.entity.Reservation;
import com.theatre.reservation.repository.ReservationRepository;
import com.theatre.reservation.repository.TicketRepository;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Entry point for reservations. Creation is deliberately not transactional here:
 * the transaction lives in {@link ReservationWriter} so that constraint violations
 * raised at flush or commit reach this class and are reported as the seat that lost the race.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReservationService {

    private final ReservationWriter reservationWriter;
    private final ReservationRepository reservationRepository;
    private final TicketRepository ticketRepository;

    /**
     * Create a reservation with all its tickets, or nothing
     */
    public ReservationDto createReservation(ReservationRequest request) {
        List<TicketRequest> tickets = request.getTickets();
        validateTicketRequests(tickets);

        try {
            ReservationDto reservation = reservationWriter.write(request.getUserId(), tickets);

            log.info("Reservation created: id={} user={} tickets={}",
                    reservation.getId(), request.getUserId(), reservation.getTicketCount());

            return reservation;

        } catch (DataIntegrityViolationException e) {
            // Lost the race on the (performance, row, seat) unique constraint
            Optional<SeatAlreadyTakenException> taken = findTakenSeat(tickets, e);
            if (taken.isEmpty()) {
                log.error("Integrity violation without a visible seat conflict for user={}", request.getUserId(), e);
                throw e;
            }
            throw taken.get();

        } catch (ConcurrencyFailureException e) {
            // Lock timeout or deadlock while a competing insert was pending
            Optional<SeatAlreadyTakenException> taken = findTakenSeat(tickets, e);
            if (taken.isEmpty()) {
                throw new StorageUnavailableException(
                    "Reservation could not be completed due to concurrent activity, please retry", e);
            }
            throw taken.get();

        } catch (CannotCreateTransactionException | DataAccessResourceFailureException e) {
            log.error("Storage unavailable while creating reservation for user={}", request.getUserId(), e);
            throw new StorageUnavailableException("Reservation storage is temporarily unavailable", e);
        }
    }

    /**
     * Get a user's reservations, newest first
     */
    @Transactional(readOnly = true)
    public Page<ReservationDto> getReservations(Long userId, int page, int size) {
        log.debug("Fetching reservations: user={} page={} size={}", userId, page, size);

        Pageable pageable = PageRequest.of(page, size);
        Page<Reservation> reservations = reservationRepository.findByUserIdOrderByCreatedAtDescIdDesc(userId, pageable);

        List<Long> ids = reservations.getContent().stream().map(Reservation::getId).toList();
        if (ids.isEmpty()) {
            return new PageImpl<>(List.of(), pageable, reservations.getTotalElements());
        }

        Map<Long, Reservation> loaded = reservationRepository.findWithTicketsByIdIn(ids).stream()
            .collect(Collectors.toMap(Reservation::getId, Function.identity()));

        List<ReservationDto> content = ids.stream()
            .map(loaded::get)
            .map(ReservationMapper::toListDto)
            .toList();

        return new PageImpl<>(content, pageable, reservations.getTotalElements());
    }

    /**
     * Get a single reservation owned by the user
     */
    @Transactional(readOnly = true)
    public Optional<ReservationDto> getReservation(Long reservationId, Long userId) {
        log.debug("Fetching reservation: id={} user={}", reservationId, userId);

        return reservationRepository.findByIdAndUserIdWithTickets(reservationId, userId)
            .map(ReservationMapper::toListDto);
    }

    private void validateTicketRequests(List<TicketRequest> tickets) {
        if (tickets == null || tickets.isEmpty()) {
            throw new EmptyReservationException();
        }

        Set<SeatKey> seen = new HashSet<>();
        for (int i = 0; i < tickets.size(); i++) {
            TicketRequest ticket = tickets.get(i);
            if (ticket == null) {
                throw new ReservationException("Ticket entry " + i + " is missing");
            }
            if (!seen.add(SeatKey.of(ticket))) {
                throw new SeatAlreadyTakenException(ticket.getPerformanceId(), ticket.getRow(), ticket.getSeat());
            }
        }
    }

    /**
     * Runs outside the failed transaction, so it sees the competing reservation once committed.
     */
    private Optional<SeatAlreadyTakenException> findTakenSeat(List<TicketRequest> tickets, Throwable cause) {
        try {
            return tickets.stream()
                .filter(ticket -> ticketRepository.existsByPerformanceIdAndRowAndSeat(
                    ticket.getPerformanceId(), ticket.getRow(), ticket.getSeat()))
                .findFirst()
                .map(ticket -> {
                    log.warn("Seat taken by a concurrent reservation: performance={} row={} seat={}",
                            ticket.getPerformanceId(), ticket.getRow(), ticket.getSeat());
                    return new SeatAlreadyTakenException(
                        ticket.getPerformanceId(), ticket.getRow(), ticket.getSeat(), cause);
                });
        } catch (DataAccessException lookupFailure) {
            throw new StorageUnavailableException("Reservation storage is temporarily unavailable", lookupFailure);
        }
    }

    @Value
    private static class SeatKey {
        Long performanceId;
        Integer row;
        Integer seat;

        static SeatKey of(TicketRequest ticket) {
            return new SeatKey(ticket.getPerformanceId(), ticket.getRow(), ticket.getSeat());
        }
    }
}
