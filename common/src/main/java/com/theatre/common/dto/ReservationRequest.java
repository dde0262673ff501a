package com.theatre.common.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.util.List;

/**
 * Tickets are intentionally not {@code @NotEmpty}: an empty list is reported
 * by the reservation service as an empty-reservation error.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReservationRequest {

    @NotNull(message = "User ID is required")
    private Long userId;

    private List<@NotNull(message = "Ticket entries must not be null") @Valid TicketRequest> tickets;
}
