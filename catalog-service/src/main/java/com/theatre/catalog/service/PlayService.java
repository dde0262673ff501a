package com.theatre.catalog.service;

import com.theatre.catalog.repository.ArtistRepository;
import com.theatre.catalog.repository.GenreRepository;
import com.theatre.catalog.repository.PlayRepository;
import com.theatre.common.dto.PlayDetailDto;
import com.theatre.common.dto.PlayListDto;
import com.theatre.common.dto.PlayRequest;
import com.theatre.common.entity.Artist;
import com.theatre.common.entity.Genre;
import com.theatre.common.entity.Play;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class PlayService {

    // Never matches a generated id; stands in for an absent filter list
    private static final List<Long> NO_IDS = List.of(-1L);

    private final PlayRepository playRepository;
    private final GenreRepository genreRepository;
    private final ArtistRepository artistRepository;

    /**
     * Plays filtered by title fragment and any-of genre / artist ids, ordered by title
     */
    @Transactional(readOnly = true)
    public Page<PlayListDto> getPlays(String title, List<Long> genreIds, List<Long> artistIds, int page, int size) {
        log.debug("Searching plays: title={}, genres={}, artists={}, page={}, size={}",
                 title, genreIds, artistIds, page, size);

        boolean anyGenre = genreIds != null && !genreIds.isEmpty();
        boolean anyArtist = artistIds != null && !artistIds.isEmpty();
        Pageable pageable = PageRequest.of(page, size);

        Page<Play> plays = playRepository.findWithFilters(
            title != null ? title.trim() : "",
            anyGenre, anyGenre ? genreIds : NO_IDS,
            anyArtist, anyArtist ? artistIds : NO_IDS,
            pageable);

        List<Long> ids = plays.getContent().stream().map(Play::getId).toList();
        if (ids.isEmpty()) {
            return new PageImpl<>(List.of(), pageable, plays.getTotalElements());
        }

        Map<Long, Play> withGenres = playRepository.findWithGenresByIdIn(ids).stream()
            .collect(Collectors.toMap(Play::getId, Function.identity()));

        List<PlayListDto> content = ids.stream()
            .map(withGenres::get)
            .map(CatalogMapper::toPlayListDto)
            .toList();

        return new PageImpl<>(content, pageable, plays.getTotalElements());
    }

    @Cacheable(value = "play_details", key = "#playId")
    @Transactional(readOnly = true)
    public Optional<PlayDetailDto> getPlayById(Long playId) {
        log.debug("Fetching play details for ID: {}", playId);

        return playRepository.findByIdWithDetails(playId)
            .map(CatalogMapper::toPlayDetailDto);
    }

    /**
     * Create a play; every referenced genre and artist must exist
     */
    @CacheEvict(value = "artist_details", allEntries = true)
    @Transactional
    public PlayDetailDto createPlay(PlayRequest request) {
        log.info("Creating play: {}", request.getTitle());

        Play play = Play.builder()
            .title(request.getTitle().trim())
            .description(request.getDescription())
            .acts(request.getActs())
            .genres(resolve(genreRepository, request.getGenreIds(), Genre::getId, "Genre"))
            .artists(resolve(artistRepository, request.getArtistIds(), Artist::getId, "Artist"))
            .build();

        Play saved = playRepository.save(play);

        log.info("Play created: ID={}, title={}, genres={}, artists={}",
                saved.getId(), saved.getTitle(), saved.getGenres().size(), saved.getArtists().size());

        return CatalogMapper.toPlayDetailDto(saved);
    }

    private <T> Set<T> resolve(JpaRepository<T, Long> repository, List<Long> ids,
                               Function<T, Long> idOf, String resource) {
        if (ids == null || ids.isEmpty()) {
            return new LinkedHashSet<>();
        }

        Set<Long> requested = new LinkedHashSet<>(ids);
        List<T> found = repository.findAllById(requested);

        if (found.size() != requested.size()) {
            Set<Long> foundIds = found.stream().map(idOf).collect(Collectors.toSet());
            List<Long> missing = requested.stream().filter(id -> !foundIds.contains(id)).toList();
            throw ResourceNotFoundException.of(resource, missing);
        }

        return new LinkedHashSet<>(found);
    }
}
