package com.theatre.catalog.controller;

import com.theatre.catalog.service.TheatreHallService;
import com.theatre.common.dto.TheatreHallDto;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
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
@RequestMapping("/api/theatre-halls")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Theatre Hall Controller", description = "Halls and their seat grids")
public class TheatreHallController {

    private final TheatreHallService theatreHallService;

    @GetMapping
    @Operation(summary = "List theatre halls")
    public ResponseEntity<List<TheatreHallDto>> getTheatreHalls() {
        return ResponseEntity.ok(theatreHallService.getAllTheatreHalls());
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get theatre hall", description = "Hall with rows, seats per row and capacity.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Theatre hall found"),
        @ApiResponse(responseCode = "404", description = "Theatre hall not found")
    })
    public ResponseEntity<TheatreHallDto> getTheatreHall(
            @Parameter(description = "Theatre hall ID") @PathVariable Long id) {

        return theatreHallService.getTheatreHallById(id)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping
    @Operation(summary = "Create theatre hall")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Theatre hall created"),
        @ApiResponse(responseCode = "400", description = "Invalid hall data")
    })
    public ResponseEntity<TheatreHallDto> createTheatreHall(@Valid @RequestBody TheatreHallDto hallDto) {
        log.info("Theatre hall creation request: {}", hallDto.getName());

        return ResponseEntity.status(HttpStatus.CREATED).body(theatreHallService.createTheatreHall(hallDto));
    }
}
