package com.theatre.catalog.controller;

import com.theatre.catalog.service.ArtistService;
import com.theatre.common.dto.ArtistDetailDto;
import com.theatre.common.dto.ArtistDto;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Optional;

@RestController
@RequestMapping("/api/artists")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Artist Controller", description = "Artists appearing in plays")
public class ArtistController {

    private final ArtistService artistService;

    @GetMapping
    @Operation(summary = "Search artists", description = "Case-insensitive match on first or last name.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Artists found"),
        @ApiResponse(responseCode = "400", description = "Invalid paging parameters")
    })
    public ResponseEntity<Page<ArtistDto>> getArtists(
            @Parameter(description = "Name fragment") @RequestParam(required = false) String search,
            @Parameter(description = "Page number (0-based)") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "10") int size) {

        if (page < 0 || size < 1 || size > 100) {
            return ResponseEntity.badRequest().build();
        }

        return ResponseEntity.ok(artistService.getArtists(search, page, size));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get artist details", description = "Artist with the plays they appear in.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Artist found"),
        @ApiResponse(responseCode = "404", description = "Artist not found")
    })
    public ResponseEntity<ArtistDetailDto> getArtist(@Parameter(description = "Artist ID") @PathVariable Long id) {
        Optional<ArtistDetailDto> artist = artistService.getArtistById(id);

        if (artist.isPresent()) {
            return ResponseEntity.ok(artist.get());
        } else {
            log.debug("Artist not found: {}", id);
            return ResponseEntity.notFound().build();
        }
    }

    @PostMapping
    @Operation(summary = "Create artist")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Artist created"),
        @ApiResponse(responseCode = "400", description = "Invalid artist data")
    })
    public ResponseEntity<ArtistDto> createArtist(@Valid @RequestBody ArtistDto artistDto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(artistService.createArtist(artistDto));
    }
}
