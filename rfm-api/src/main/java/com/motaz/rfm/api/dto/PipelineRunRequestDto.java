package com.motaz.rfm.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineRunRequestDto {

    @Schema(description = "Snapshot date, defaults to now", example = "2024-06-30T00:00:00")
    private LocalDateTime calcDate;

    @Min(value = 1, message = "windowDays must be at least 1")
    @Schema(example = "365")
    private Integer windowDays;

    @Min(value = 1, message = "k must be at least 1")
    @Schema(example = "5")
    private Integer k;
}
