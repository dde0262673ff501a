package com.theatre.common.dto;

import jakarta.validation.constraints.*;
import lombok.*;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlayRequest {

    @NotBlank(message = "Title is required")
    @Size(max = 255, message = "Title must not exceed 255 characters")
    private String title;

    @NotBlank(message = "Description is required")
    private String description;

    @NotNull(message = "Number of acts is required")
    @Positive(message = "Number of acts must be positive")
    private Integer acts;

    private List<Long> genreIds;

    private List<Long> artistIds;
}
