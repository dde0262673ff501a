package com.theatre.catalog.repository;

import com.theatre.common.entity.Artist;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface ArtistRepository extends JpaRepository<Artist, Long> {

    /**
     * Case-insensitive match on first or last name; an empty query matches everyone
     */
    @Query("SELECT a FROM Artist a WHERE " +
           "LOWER(a.firstName) LIKE LOWER(CONCAT('%', :query, '%')) OR " +
           "LOWER(a.lastName) LIKE LOWER(CONCAT('%', :query, '%')) " +
           "ORDER BY a.lastName ASC, a.firstName ASC, a.id ASC")
    Page<Artist> search(@Param("query") String query, Pageable pageable);
}
