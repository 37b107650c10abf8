package com.motaz.rfm.api.dto;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
public class SegmentListResponseDto {
    private LocalDateTime calcDate;
    private List<SegmentStatsDto> segments;
}
