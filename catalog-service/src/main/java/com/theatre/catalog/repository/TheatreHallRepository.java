package com.theatre.catalog.repository;

import com.theatre.common.entity.TheatreHall;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TheatreHallRepository extends JpaRepository<TheatreHall, Long> {

    List<TheatreHall> findAllByOrderByNameAsc();
}
