package com.theatre.common.dto;

import jakarta.validation.constraints.NotNull;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TicketRequest {

    @NotNull(message = "Performance ID is required")
    private Long performanceId;

    @NotNull(message = "Row is required")
    private Integer row;

    @NotNull(message = "Seat is required")
    private Integer seat;
}
