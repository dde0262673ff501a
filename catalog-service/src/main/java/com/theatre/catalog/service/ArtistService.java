package com.theatre.catalog.service;

import com.theatre.catalog.repository.ArtistRepository;
import com.theatre.catalog.repository.PlayRepository;
import com.theatre.common.dto.ArtistDetailDto;
import com.theatre.common.dto.ArtistDto;
import com.theatre.common.entity.Artist;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class ArtistService {

    private final ArtistRepository artistRepository;
    private final PlayRepository playRepository;

    /**
     * Search artists by first or last name
     */
    @Transactional(readOnly = true)
    public Page<ArtistDto> getArtists(String search, int page, int size) {
        log.debug("Searching artists: search={}, page={}, size={}", search, page, size);

        String query = search != null ? search.trim() : "";

        return artistRepository.search(query, PageRequest.of(page, size))
            .map(CatalogMapper::toArtistDto);
    }

    /**
     * Artist with the plays they appear in
     */
    @Cacheable(value = "artist_details", key = "#artistId")
    @Transactional(readOnly = true)
    public Optional<ArtistDetailDto> getArtistById(Long artistId) {
        log.debug("Fetching artist details for ID: {}", artistId);

        return artistRepository.findById(artistId)
            .map(artist -> CatalogMapper.toArtistDetailDto(
                artist, playRepository.findByArtistsIdOrderByTitleAsc(artistId)));
    }

    @Transactional
    public ArtistDto createArtist(ArtistDto artistDto) {
        log.info("Creating artist: {} {}", artistDto.getFirstName(), artistDto.getLastName());

        Artist artist = Artist.builder()
            .firstName(artistDto.getFirstName().trim())
            .lastName(artistDto.getLastName().trim())
            .about(artistDto.getAbout())
            .build();

        Artist saved = artistRepository.save(artist);

        log.info("Artist created: ID={}", saved.getId());

        return CatalogMapper.toArtistDto(saved);
    }
}
