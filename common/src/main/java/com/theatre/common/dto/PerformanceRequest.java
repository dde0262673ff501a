package com.theatre.common.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PerformanceRequest {

    @NotNull(message = "Play ID is required")
    private Long playId;

    @NotNull(message = "Theatre hall ID is required")
    private Long theatreHallId;

    @NotNull(message = "Show time is required")
    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime showTime;
}
