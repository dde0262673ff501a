package com.theatre.catalog.repository;

import com.theatre.common.entity.Play;
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
public interface PlayRepository extends JpaRepository<Play, Long> {

    /**
     * Filter plays by title fragment and any-of genre / artist ids.
     * Empty id lists cannot be bound in JPQL, so callers pass a placeholder list with the flag off.
     */
    @Query(value = "SELECT DISTINCT p FROM Play p " +
                   "LEFT JOIN p.genres g " +
                   "LEFT JOIN p.artists a " +
                   "WHERE LOWER(p.title) LIKE LOWER(CONCAT('%', :title, '%')) " +
                   "AND (:anyGenre = false OR g.id IN :genreIds) " +
                   "AND (:anyArtist = false OR a.id IN :artistIds) " +
                   "ORDER BY p.title ASC, p.id ASC",
           countQuery = "SELECT COUNT(DISTINCT p) FROM Play p " +
                        "LEFT JOIN p.genres g " +
                        "LEFT JOIN p.artists a " +
                        "WHERE LOWER(p.title) LIKE LOWER(CONCAT('%', :title, '%')) " +
                        "AND (:anyGenre = false OR g.id IN :genreIds) " +
                        "AND (:anyArtist = false OR a.id IN :artistIds)")
    Page<Play> findWithFilters(@Param("title") String title,
                               @Param("anyGenre") boolean anyGenre,
                               @Param("genreIds") Collection<Long> genreIds,
                               @Param("anyArtist") boolean anyArtist,
                               @Param("artistIds") Collection<Long> artistIds,
                               Pageable pageable);

    /**
     * Play with genres and artists for the detail view
     */
    @Query("SELECT DISTINCT p FROM Play p " +
           "LEFT JOIN FETCH p.genres " +
           "LEFT JOIN FETCH p.artists " +
           "WHERE p.id = :id")
    Optional<Play> findByIdWithDetails(@Param("id") Long id);

    /**
     * Genres for a page of plays, fetched separately to keep paging in SQL
     */
    @Query("SELECT DISTINCT p FROM Play p LEFT JOIN FETCH p.genres WHERE p.id IN :ids")
    List<Play> findWithGenresByIdIn(@Param("ids") Collection<Long> ids);

    List<Play> findByArtistsIdOrderByTitleAsc(Long artistId);
}
