package com.theatre.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TicketDto {

    private Long id;

    private Integer row;

    private Integer seat;

    private Long performanceId;

    private PerformanceListDto performance; // For list view
}
