package com.theatre.common.dto;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AvailabilityDto {

    private Long performanceId;

    private Integer capacity;

    private Long ticketsSold;

    private Integer ticketsAvailable;

    public boolean isSoldOut() {
        return ticketsAvailable != null && ticketsAvailable <= 0;
    }
}
