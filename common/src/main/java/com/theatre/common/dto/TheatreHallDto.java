package com.theatre.common.dto;

import com.theatre.common.entity.TheatreHall;
import jakarta.validation.constraints.*;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TheatreHallDto {

    private Long id;

    @NotBlank(message = "Hall name is required")
    @Size(max = 255)
    private String name;

    @NotNull(message = "Number of rows is required")
    @Positive(message = "Number of rows must be positive")
    @Max(value = TheatreHall.MAX_ROWS, message = "Number of rows must not exceed 1000")
    private Integer rows;

    @NotNull(message = "Seats in row is required")
    @Positive(message = "Seats in row must be positive")
    @Max(value = TheatreHall.MAX_SEATS_IN_ROW, message = "Seats in row must not exceed 1000")
    private Integer seatsInRow;

    private Integer capacity;
}
