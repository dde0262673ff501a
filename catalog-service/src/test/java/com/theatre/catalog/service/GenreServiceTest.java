package com.theatre.catalog.service;

import com.theatre.catalog.repository.GenreRepository;
import com.theatre.common.dto.GenreDto;
import com.theatre.common.entity.Genre;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GenreServiceTest {

    @Mock
    private GenreRepository genreRepository;

    @InjectMocks
    private GenreService genreService;

    @Test
    void getAllGenres() {
        when(genreRepository.findAllByOrderByNameAsc()).thenReturn(List.of(
            Genre.builder().id(2L).name("Comedy").build(),
            Genre.builder().id(1L).name("Drama").build()
        ));

        List<GenreDto> result = genreService.getAllGenres();

        assertEquals(2, result.size());
        assertEquals("Comedy", result.get(0).getName());
    }

    @Test
    void createGenre_TrimsName() {
        when(genreRepository.existsByNameIgnoreCase("Tragedy")).thenReturn(false);
        when(genreRepository.saveAndFlush(any(Genre.class))).thenAnswer(invocation -> {
            Genre genre = invocation.getArgument(0);
            genre.setId(3L);
            return genre;
        });

        GenreDto result = genreService.createGenre(GenreDto.builder().name("  Tragedy ").build());

        assertEquals(3L, result.getId());
        assertEquals("Tragedy", result.getName());
    }

    @Test
    void createGenre_ExistingName_ThrowsDuplicate() {
        when(genreRepository.existsByNameIgnoreCase("drama")).thenReturn(true);

        assertThrows(DuplicateResourceException.class,
            () -> genreService.createGenre(GenreDto.builder().name("drama").build()));

        verify(genreRepository, never()).saveAndFlush(any());
    }

    @Test
    void createGenre_ConcurrentInsert_ThrowsDuplicate() {
        when(genreRepository.existsByNameIgnoreCase("Drama")).thenReturn(false);
        when(genreRepository.saveAndFlush(any(Genre.class)))
            .thenThrow(new DataIntegrityViolationException("genres_name_key"));

        DuplicateResourceException exception = assertThrows(DuplicateResourceException.class,
            () -> genreService.createGenre(GenreDto.builder().name("Drama").build()));

        assertInstanceOf(DataIntegrityViolationException.class, exception.getCause());
    }
}
