package com.theatre.catalog.controller;

import com.theatre.catalog.service.PlayService;
import com.theatre.common.dto.PlayDetailDto;
import com.theatre.common.dto.PlayListDto;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PlayControllerTest {

    @Mock
    private PlayService playService;

    @InjectMocks
    private PlayController playController;

    @Test
    void getPlays_PassesFilters() {
        Page<PlayListDto> page = new PageImpl<>(
            List.of(PlayListDto.builder().id(7L).title("The Seagull").genres(List.of("Drama")).acts(4).build()),
            PageRequest.of(0, 10), 1);
        when(playService.getPlays("sea", List.of(1L, 2L), List.of(3L), 0, 10)).thenReturn(page);

        ResponseEntity<Page<PlayListDto>> result =
            playController.getPlays("sea", List.of(1L, 2L), List.of(3L), 0, 10);

        assertEquals(HttpStatus.OK, result.getStatusCode());
        assertEquals("The Seagull", result.getBody().getContent().get(0).getTitle());
    }

    @Test
    void getPlays_InvalidSize_Returns400() {
        assertEquals(HttpStatus.BAD_REQUEST, playController.getPlays(null, null, null, 0, 0).getStatusCode());
        verifyNoInteractions(playService);
    }

    @Test
    void getPlay_Found() {
        when(playService.getPlayById(7L)).thenReturn(Optional.of(
            PlayDetailDto.builder().id(7L).title("The Seagull").genres(List.of()).artists(List.of()).build()));

        assertEquals(HttpStatus.OK, playController.getPlay(7L).getStatusCode());
    }

    @Test
    void getPlay_NotFound() {
        when(playService.getPlayById(99L)).thenReturn(Optional.empty());

        assertEquals(HttpStatus.NOT_FOUND, playController.getPlay(99L).getStatusCode());
    }
}
