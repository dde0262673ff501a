package com.theatre.common.dto;

import lombok.*;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlaySummaryDto implements Serializable {

    private static final long serialVersionUID = 1L;

    private Long id;

    private String title;
}
