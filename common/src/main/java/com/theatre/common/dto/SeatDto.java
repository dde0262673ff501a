package com.theatre.common.dto;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SeatDto {

    private Integer row;

    private Integer seat;
}
