package com.theatre.catalog.repository;

import com.theatre.common.entity.Performance;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;

@Repository
public interface PerformanceRepository extends JpaRepository<Performance, Long> {

    /**
     * Performances with play and hall, optionally for one play, within [from, to)
     */
    @Query(value = "SELECT p FROM Performance p " +
                   "JOIN FETCH p.play " +
                   "JOIN FETCH p.theatreHall " +
                   "WHERE (:playId IS NULL OR p.play.id = :playId) " +
                   "AND p.showTime >= :from AND p.showTime < :to " +
                   "ORDER BY p.showTime DESC, p.id DESC",
           countQuery = "SELECT COUNT(p) FROM Performance p " +
                        "WHERE (:playId IS NULL OR p.play.id = :playId) " +
                        "AND p.showTime >= :from AND p.showTime < :to")
    Page<Performance> findWithFilters(@Param("playId") Long playId,
                                      @Param("from") LocalDateTime from,
                                      @Param("to") LocalDateTime to,
                                      Pageable pageable);

    @Query("SELECT p FROM Performance p " +
           "JOIN FETCH p.play " +
           "JOIN FETCH p.theatreHall " +
           "WHERE p.id = :id")
    Optional<Performance> findByIdWithDetails(@Param("id") Long id);
}
