package com.theatre.catalog.repository;

import com.theatre.common.entity.Ticket;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Read-only view of sold tickets; tickets are written by the reservation service only.
 */
@Repository
public interface TicketRepository extends JpaRepository<Ticket, Long> {

    long countByPerformanceId(Long performanceId);

    /**
     * Sold ticket counts for a page of performances
     */
    @Query("SELECT t.performance.id AS performanceId, COUNT(t) AS ticketsSold " +
           "FROM Ticket t WHERE t.performance.id IN :performanceIds " +
           "GROUP BY t.performance.id")
    List<PerformanceTicketCount> countByPerformanceIds(@Param("performanceIds") Collection<Long> performanceIds);

    List<Ticket> findByPerformanceIdOrderByRowAscSeatAsc(Long performanceId);

    /**
     * Tickets of a performance that would not fit a hall of the given size
     */
    @Query("SELECT COUNT(t) FROM Ticket t WHERE t.performance.id = :performanceId " +
           "AND (t.row > :rows OR t.seat > :seatsInRow)")
    long countOutsideGrid(@Param("performanceId") Long performanceId,
                          @Param("rows") int rows,
                          @Param("seatsInRow") int seatsInRow);

    interface PerformanceTicketCount {

        Long getPerformanceId();

        Long getTicketsSold();
    }
}
