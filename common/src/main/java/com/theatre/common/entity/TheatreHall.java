package com.theatre.common.entity;

import jakarta.persistence.*;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.*;

@Entity
@Table(name = "theatre_halls")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TheatreHall {

    public static final int MAX_ROWS = 1000;
    public static final int MAX_SEATS_IN_ROW = 1000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Size(max = 255)
    @Column(nullable = false)
    private String name;

    @NotNull
    @Positive
    @Max(MAX_ROWS)
    @Column(name = "row_count", nullable = false)
    private Integer rows;

    @NotNull
    @Positive
    @Max(MAX_SEATS_IN_ROW)
    @Column(name = "seats_in_row", nullable = false)
    private Integer seatsInRow;

    /**
     * Total sellable seats for any performance held in this hall.
     */
    public int getCapacity() {
        return Math.multiplyExact(rows, seatsInRow);
    }
}
