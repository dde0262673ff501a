package com.theatre.reservation.controller;

import com.theatre.common.dto.ReservationDto;
import com.theatre.common.dto.ReservationRequest;
import com.theatre.reservation.service.ReservationException;
import com.theatre.reservation.service.ReservationNotFoundException;
import com.theatre.reservation.service.ReservationService;
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
@RequestMapping("/api/reservations")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Reservation Controller", description = "Atomic seat reservations for performances")
public class ReservationController {

    private final ReservationService reservationService;

    @PostMapping
    @Operation(
        summary = "Reserve seats",
        description = "Create a reservation for one or more (performance, row, seat) tickets. " +
                     "Either every ticket is sold or nothing is; a seat already sold, including one " +
                     "sold concurrently, fails the whole reservation with 409."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Reservation created"),
        @ApiResponse(responseCode = "400", description = "Empty reservation or seat outside the hall"),
        @ApiResponse(responseCode = "404", description = "Performance not found"),
        @ApiResponse(responseCode = "409", description = "Seat already taken"),
        @ApiResponse(responseCode = "503", description = "Storage unavailable, safe to retry")
    })
    public ResponseEntity<ReservationDto> createReservation(@Valid @RequestBody ReservationRequest request) {

        log.info("Reservation request received for user: {} tickets: {}",
                request.getUserId(), request.getTickets() != null ? request.getTickets().size() : 0);

        try {
            ReservationDto reservation = reservationService.createReservation(request);

            log.info("Reservation successful: {} for user: {}", reservation.getId(), request.getUserId());

            return ResponseEntity.status(HttpStatus.CREATED).body(reservation);

        } catch (ReservationException e) {
            log.warn("Reservation failed for user: {} - {}", request.getUserId(), e.getMessage());
            throw e; // Will be handled by global exception handler
        }
    }

    @GetMapping
    @Operation(
        summary = "List user reservations",
        description = "Page through the user's reservations, newest first, with performance details per ticket."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Reservations found"),
        @ApiResponse(responseCode = "400", description = "Invalid paging parameters")
    })
    public ResponseEntity<Page<ReservationDto>> getReservations(
            @Parameter(description = "Owner of the reservations") @RequestParam Long userId,
            @Parameter(description = "Page number (0-based)") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "10") int size) {

        if (page < 0 || size < 1 || size > 100) {
            return ResponseEntity.badRequest().build();
        }

        return ResponseEntity.ok(reservationService.getReservations(userId, page, size));
    }

    @GetMapping("/{id}")
    @Operation(
        summary = "Get reservation details",
        description = "Retrieve one reservation of the user with all its tickets."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Reservation found"),
        @ApiResponse(responseCode = "404", description = "Reservation not found")
    })
    public ResponseEntity<ReservationDto> getReservation(
            @Parameter(description = "Reservation ID") @PathVariable Long id,
            @Parameter(description = "Owner of the reservation") @RequestParam Long userId) {

        log.debug("Reservation lookup request for: {} user: {}", id, userId);

        Optional<ReservationDto> reservation = reservationService.getReservation(id, userId);

        if (reservation.isPresent()) {
            return ResponseEntity.ok(reservation.get());
        } else {
            log.debug("Reservation not found: {}", id);
            throw new ReservationNotFoundException("Reservation not found: " + id);
        }
    }
}
