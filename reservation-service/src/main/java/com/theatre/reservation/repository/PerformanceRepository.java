package com.theatre.reservation.repository;

import com.theatre.common.entity.Performance;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface PerformanceRepository extends JpaRepository<Performance, Long> {

    /**
     * Resolve performances together with their halls for seat validation
     */
    @Query("SELECT p FROM Performance p JOIN FETCH p.theatreHall WHERE p.id IN :ids")
    List<Performance> findWithHallByIdIn(@Param("ids") Collection<Long> ids);
}
