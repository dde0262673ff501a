package com.theatre.catalog.controller;

import com.theatre.catalog.service.GenreService;
import com.theatre.common.dto.GenreDto;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/genres")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Genre Controller", description = "Play genres")
public class GenreController {

    private final GenreService genreService;

    @GetMapping
    @Operation(summary = "List genres", description = "All genres ordered by name.")
    public ResponseEntity<List<GenreDto>> getGenres() {
        return ResponseEntity.ok(genreService.getAllGenres());
    }

    @PostMapping
    @Operation(summary = "Create genre", description = "Genre names are unique, ignoring case.")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Genre created"),
        @ApiResponse(responseCode = "400", description = "Invalid genre data"),
        @ApiResponse(responseCode = "409", description = "Genre already exists")
    })
    public ResponseEntity<GenreDto> createGenre(@Valid @RequestBody GenreDto genreDto) {
        log.info("Genre creation request: {}", genreDto.getName());

        GenreDto created = genreService.createGenre(genreDto);

        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }
}
