package com.theatre.catalog.controller;

import com.theatre.catalog.service.PerformanceService;
import com.theatre.common.dto.AvailabilityDto;
import com.theatre.common.dto.PerformanceDetailDto;
import com.theatre.common.dto.PerformanceListDto;
import com.theatre.common.dto.PerformanceRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.Optional;

@RestController
@RequestMapping("/api/performances")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Performance Controller", description = "Scheduled performances and live seat availability")
public class PerformanceController {

    private final PerformanceService performanceService;

    @GetMapping
    @Operation(
        summary = "Search performances",
        description = "Browse performances, newest show time first, optionally for one play and one day. " +
                     "Each item carries the number of seats still available."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Performances found"),
        @ApiResponse(responseCode = "400", description = "Invalid search parameters")
    })
    public ResponseEntity<Page<PerformanceListDto>> getPerformances(
            @Parameter(description = "Filter by play ID")
            @RequestParam(name = "play", required = false) Long playId,

            @Parameter(description = "Filter by show date (yyyy-MM-dd)")
            @RequestParam(required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,

            @Parameter(description = "Page number (0-based)")
            @RequestParam(defaultValue = "0") int page,

            @Parameter(description = "Page size")
            @RequestParam(defaultValue = "10") int size) {

        log.debug("Performance search request: play={}, date={}, page={}, size={}", playId, date, page, size);

        if (page < 0 || size < 1 || size > 100) {
            return ResponseEntity.badRequest().build();
        }

        return ResponseEntity.ok(performanceService.getPerformances(playId, date, page, size));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get performance details", description = "Play, hall and the seats already taken.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Performance found"),
        @ApiResponse(responseCode = "404", description = "Performance not found")
    })
    public ResponseEntity<PerformanceDetailDto> getPerformance(
            @Parameter(description = "Performance ID") @PathVariable Long id) {

        Optional<PerformanceDetailDto> performance = performanceService.getPerformanceById(id);

        if (performance.isPresent()) {
            return ResponseEntity.ok(performance.get());
        } else {
            log.debug("Performance not found: {}", id);
            return ResponseEntity.notFound().build();
        }
    }

    @GetMapping("/{id}/availability")
    @Operation(
        summary = "Get seat availability",
        description = "Hall capacity minus tickets sold, computed from committed reservations on every call."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Availability computed"),
        @ApiResponse(responseCode = "404", description = "Performance not found")
    })
    public ResponseEntity<AvailabilityDto> getAvailability(
            @Parameter(description = "Performance ID") @PathVariable Long id) {

        return performanceService.getAvailability(id)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping
    @Operation(summary = "Schedule performance")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Performance created"),
        @ApiResponse(responseCode = "400", description = "Invalid performance data"),
        @ApiResponse(responseCode = "404", description = "Unknown play or theatre hall")
    })
    public ResponseEntity<PerformanceListDto> createPerformance(@Valid @RequestBody PerformanceRequest request) {
        log.info("Performance creation request: play={}, hall={}", request.getPlayId(), request.getTheatreHallId());

        return ResponseEntity.status(HttpStatus.CREATED).body(performanceService.createPerformance(request));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update performance", description = "Moving to a hall that excludes sold seats is refused.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Performance updated"),
        @ApiResponse(responseCode = "404", description = "Performance, play or hall not found"),
        @ApiResponse(responseCode = "409", description = "Sold tickets fall outside the new hall")
    })
    public ResponseEntity<PerformanceListDto> updatePerformance(
            @Parameter(description = "Performance ID") @PathVariable Long id,
            @Valid @RequestBody PerformanceRequest request) {

        return performanceService.updatePerformance(id, request)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete performance", description = "Sold tickets for the performance are deleted with it.")
    @ApiResponses({
        @ApiResponse(responseCode = "204", description = "Performance deleted"),
        @ApiResponse(responseCode = "404", description = "Performance not found")
    })
    public ResponseEntity<Void> deletePerformance(@Parameter(description = "Performance ID") @PathVariable Long id) {
        if (performanceService.deletePerformance(id)) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.notFound().build();
    }
}
