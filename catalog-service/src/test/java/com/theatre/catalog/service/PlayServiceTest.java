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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PlayServiceTest {

    @Mock
    private PlayRepository playRepository;

    @Mock
    private GenreRepository genreRepository;

    @Mock
    private ArtistRepository artistRepository;

    @InjectMocks
    private PlayService playService;

    private Genre drama;
    private Genre comedy;
    private Artist artist;

    @BeforeEach
    void setUp() {
        drama = Genre.builder().id(1L).name("Drama").build();
        comedy = Genre.builder().id(2L).name("Comedy").build();
        artist = Artist.builder().id(5L).firstName("Olga").lastName("Knipper").build();
    }

    @Test
    void getPlays_WithoutFilters_DisablesIdFilters() {
        PageRequest pageable = PageRequest.of(0, 10);
        when(playRepository.findWithFilters(eq(""), eq(false), anyCollection(), eq(false), anyCollection(), eq(pageable)))
            .thenReturn(new PageImpl<>(List.of(), pageable, 0));

        Page<PlayListDto> result = playService.getPlays(null, null, List.of(), 0, 10);

        assertTrue(result.isEmpty());
        verify(playRepository, never()).findWithGenresByIdIn(any());
    }

    @Test
    void getPlays_GenreFilter_ReturnsGenreNames() {
        Play play = Play.builder().id(7L).title("The Seagull").description("d").acts(4)
            .genres(new LinkedHashSet<>(Set.of(drama, comedy))).build();

        PageRequest pageable = PageRequest.of(0, 10);
        when(playRepository.findWithFilters(eq("sea"), eq(true), eq(List.of(1L, 2L)), eq(false), anyCollection(), eq(pageable)))
            .thenReturn(new PageImpl<>(List.of(play), pageable, 1));
        when(playRepository.findWithGenresByIdIn(List.of(7L))).thenReturn(List.of(play));

        Page<PlayListDto> result = playService.getPlays(" sea ", List.of(1L, 2L), null, 0, 10);

        assertEquals(1, result.getTotalElements());
        assertEquals(List.of("Comedy", "Drama"), result.getContent().get(0).getGenres());
    }

    @Test
    void getPlayById_ReturnsGenresAndArtistNames() {
        Play play = Play.builder().id(7L).title("The Seagull").description("d").acts(4)
            .genres(new LinkedHashSet<>(List.of(drama)))
            .artists(new LinkedHashSet<>(List.of(artist)))
            .build();
        when(playRepository.findByIdWithDetails(7L)).thenReturn(Optional.of(play));

        PlayDetailDto result = playService.getPlayById(7L).orElseThrow();

        assertEquals("Drama", result.getGenres().get(0).getName());
        assertEquals(List.of("Olga Knipper"), result.getArtists());
    }

    @Test
    void createPlay_UnknownGenre_Throws() {
        when(genreRepository.findAllById(any())).thenReturn(List.of(drama));

        PlayRequest request = PlayRequest.builder()
            .title("Ivanov").description("Drama in four acts").acts(4)
            .genreIds(List.of(1L, 42L))
            .build();

        ResourceNotFoundException exception = assertThrows(ResourceNotFoundException.class,
            () -> playService.createPlay(request));

        assertEquals("Genre", exception.getResource());
        assertEquals(42L, exception.getId());
        verify(playRepository, never()).save(any());
    }

    @Test
    void createPlay_LinksGenresAndArtists() {
        when(genreRepository.findAllById(any())).thenReturn(List.of(drama));
        when(artistRepository.findAllById(any())).thenReturn(List.of(artist));
        when(playRepository.save(any(Play.class))).thenAnswer(invocation -> {
            Play saved = invocation.getArgument(0);
            saved.setId(8L);
            return saved;
        });

        PlayRequest request = PlayRequest.builder()
            .title("Ivanov").description("Drama in four acts").acts(4)
            .genreIds(List.of(1L, 1L))
            .artistIds(List.of(5L))
            .build();

        PlayDetailDto result = playService.createPlay(request);

        assertEquals(8L, result.getId());
        assertEquals(1, result.getGenres().size());
        assertEquals(List.of("Olga Knipper"), result.getArtists());
    }
}
