package com.theatre.reservation.repository;

import com.theatre.common.entity.Reservation;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ReservationRepository extends JpaRepository<Reservation, Long> {

    /**
     * Page through a user's reservations, newest first
     */
    Page<Reservation> findByUserIdOrderByCreatedAtDescIdDesc(Long userId, Pageable pageable);

    /**
     * Load reservations with tickets, performances, plays and halls in one query.
     * Used after paging so the fetch join does not interfere with LIMIT/OFFSET.
     */
    @Query("SELECT DISTINCT r FROM Reservation r " +
           "LEFT JOIN FETCH r.tickets t " +
           "LEFT JOIN FETCH t.performance p " +
           "LEFT JOIN FETCH p.play " +
           "LEFT JOIN FETCH p.theatreHall " +
           "WHERE r.id IN :ids")
    List<Reservation> findWithTicketsByIdIn(@Param("ids") Collection<Long> ids);

    /**
     * Find a single reservation owned by the given user
     */
    @Query("SELECT DISTINCT r FROM Reservation r " +
           "LEFT JOIN FETCH r.tickets t " +
           "LEFT JOIN FETCH t.performance p " +
           "LEFT JOIN FETCH p.play " +
           "LEFT JOIN FETCH p.theatreHall " +
           "WHERE r.id = :id AND r.userId = :userId")
    Optional<Reservation> findByIdAndUserIdWithTickets(@Param("id") Long id, @Param("userId") Long userId);

    long countByUserId(Long userId);
}
