package com.motaz.rfm.api.dto;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

@Data
@Builder
public class CustomerClusterDto {
    private LocalDateTime calcDate;
    private Integer clusterId;
    private String segmentName;
    private Map<String, Object> clusterScore;
}
