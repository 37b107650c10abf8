package com.motaz.rfm.api.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SegmentStatsDto {
    private String segmentName;
    private int clusterId;
    private long customerCount;
    private double avgRecencyDays;
    private double avgFrequency;
    private double avgMonetary;
}
