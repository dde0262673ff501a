package com.theatre.catalog.service;

import com.theatre.common.dto.AvailabilityDto;
import com.theatre.common.entity.Performance;
import com.theatre.common.entity.TheatreHall;
import org.springframework.stereotype.Component;

/**
 * Seats left for a performance: the hall's capacity (rows * seats per row) minus committed tickets.
 * Pure; callers supply the ticket count read in the same request.
 */
@Component
public class AvailabilityCalculator {

    public int availableSeats(TheatreHall hall, long ticketsSold) {
        return hall.getCapacity() - Math.toIntExact(ticketsSold);
    }

    public AvailabilityDto availability(Performance performance, long ticketsSold) {
        TheatreHall hall = performance.getTheatreHall();
        return AvailabilityDto.builder()
            .performanceId(performance.getId())
            .capacity(hall.getCapacity())
            .ticketsSold(ticketsSold)
            .ticketsAvailable(availableSeats(hall, ticketsSold))
            .build();
    }
}
