package com.theatre.common.dto;

import lombok.*;

import java.io.Serializable;
import java.util.List;

/**
 * List view of a play: genres are flattened to their names.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlayListDto implements Serializable {

    private static final long serialVersionUID = 1L;

    private Long id;

    private String title;

    private List<String> genres;

    private Integer acts;
}
