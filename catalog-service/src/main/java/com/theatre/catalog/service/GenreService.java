package com.theatre.catalog.service;

import com.theatre.catalog.repository.GenreRepository;
import com.theatre.common.dto.GenreDto;
import com.theatre.common.entity.Genre;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class GenreService {

    private final GenreRepository genreRepository;

    /**
     * All genres by name - used by play filters, rarely changes
     */
    @Cacheable(value = "genres", key = "'all'")
    @Transactional(readOnly = true)
    public List<GenreDto> getAllGenres() {
        log.debug("Fetching all genres");

        return genreRepository.findAllByOrderByNameAsc().stream()
            .map(CatalogMapper::toGenreDto)
            .toList();
    }

    @CacheEvict(value = "genres", allEntries = true)
    @Transactional
    public GenreDto createGenre(GenreDto genreDto) {
        String name = genreDto.getName().trim();
        log.info("Creating genre: {}", name);

        if (genreRepository.existsByNameIgnoreCase(name)) {
            throw new DuplicateResourceException("Genre already exists: " + name);
        }

        try {
            Genre saved = genreRepository.saveAndFlush(Genre.builder().name(name).build());

            log.info("Genre created: ID={}, name={}", saved.getId(), saved.getName());

            return CatalogMapper.toGenreDto(saved);

        } catch (DataIntegrityViolationException e) {
            // Concurrent insert of the same name
            throw new DuplicateResourceException("Genre already exists: " + name, e);
        }
    }
}
