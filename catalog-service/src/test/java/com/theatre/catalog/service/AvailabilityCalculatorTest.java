package com.theatre.catalog.service;

import com.theatre.common.dto.AvailabilityDto;
import com.theatre.common.entity.Performance;
import com.theatre.common.entity.TheatreHall;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class AvailabilityCalculatorTest {

    private final AvailabilityCalculator calculator = new AvailabilityCalculator();

    private final TheatreHall hall = TheatreHall.builder().id(1L).name("Small Hall").rows(5).seatsInRow(10).build();

    @Test
    void availableSeats_UsesRowsTimesSeats() {
        assertEquals(50, calculator.availableSeats(hall, 0));
        assertEquals(47, calculator.availableSeats(hall, 3));
        assertEquals(0, calculator.availableSeats(hall, 50));
    }

    @Test
    void availableSeats_NotTheAdditiveFormula() {
        TheatreHall large = TheatreHall.builder().rows(10).seatsInRow(15).build();

        assertEquals(150, calculator.availableSeats(large, 0));
        assertNotEquals(25, calculator.availableSeats(large, 0));
    }

    @Test
    void availability_ReportsSoldOut() {
        Performance performance = Performance.builder()
            .id(3L)
            .theatreHall(hall)
            .showTime(LocalDateTime.now())
            .build();

        AvailabilityDto open = calculator.availability(performance, 49);
        AvailabilityDto full = calculator.availability(performance, 50);

        assertEquals(3L, open.getPerformanceId());
        assertEquals(50, open.getCapacity());
        assertEquals(49L, open.getTicketsSold());
        assertEquals(1, open.getTicketsAvailable());
        assertFalse(open.isSoldOut());
        assertTrue(full.isSoldOut());
    }
}
