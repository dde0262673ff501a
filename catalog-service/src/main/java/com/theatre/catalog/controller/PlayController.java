package com.theatre.catalog.controller;

import com.theatre.catalog.service.PlayService;
import com.theatre.common.dto.PlayDetailDto;
import com.theatre.common.dto.PlayListDto;
import com.theatre.common.dto.PlayRequest;
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

import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/api/plays")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Play Controller", description = "Plays with their genres and cast")
public class PlayController {

    private final PlayService playService;

    @GetMapping
    @Operation(
        summary = "Search plays",
        description = "Filter by title fragment and by any of the given genre or artist ids, e.g. genres=1,2."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Plays found"),
        @ApiResponse(responseCode = "400", description = "Invalid filter or paging parameters")
    })
    public ResponseEntity<Page<PlayListDto>> getPlays(
            @Parameter(description = "Title fragment") @RequestParam(required = false) String title,
            @Parameter(description = "Genre ids, comma separated") @RequestParam(required = false) List<Long> genres,
            @Parameter(description = "Artist ids, comma separated") @RequestParam(required = false) List<Long> artists,
            @Parameter(description = "Page number (0-based)") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "10") int size) {

        log.debug("Play search request: title={}, genres={}, artists={}", title, genres, artists);

        if (page < 0 || size < 1 || size > 100) {
            return ResponseEntity.badRequest().build();
        }

        return ResponseEntity.ok(playService.getPlays(title, genres, artists, page, size));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get play details", description = "Play with genres and artist names.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Play found"),
        @ApiResponse(responseCode = "404", description = "Play not found")
    })
    public ResponseEntity<PlayDetailDto> getPlay(@Parameter(description = "Play ID") @PathVariable Long id) {
        Optional<PlayDetailDto> play = playService.getPlayById(id);

        if (play.isPresent()) {
            return ResponseEntity.ok(play.get());
        } else {
            log.debug("Play not found: {}", id);
            return ResponseEntity.notFound().build();
        }
    }

    @PostMapping
    @Operation(summary = "Create play")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Play created"),
        @ApiResponse(responseCode = "400", description = "Invalid play data"),
        @ApiResponse(responseCode = "404", description = "Unknown genre or artist")
    })
    public ResponseEntity<PlayDetailDto> createPlay(@Valid @RequestBody PlayRequest request) {
        log.info("Play creation request: {}", request.getTitle());

        return ResponseEntity.status(HttpStatus.CREATED).body(playService.createPlay(request));
    }
}
