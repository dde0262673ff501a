package com.theatre.reservation.repository;

import com.theatre.common.entity.Ticket;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TicketRepository extends JpaRepository<Ticket, Long> {

    /**
     * Check whether a seat is already sold for a performance.
     * Only committed tickets of other transactions are visible here.
     */
    boolean existsByPerformanceIdAndRowAndSeat(Long performanceId, Integer row, Integer seat);

    /**
     * Count sold tickets for a performance
     */
    long countByPerformanceId(Long performanceId);

    /**
     * Sold seats for a performance in seat-map order
     */
    List<Ticket> findByPerformanceIdOrderByRowAscSeatAsc(Long performanceId);
}
