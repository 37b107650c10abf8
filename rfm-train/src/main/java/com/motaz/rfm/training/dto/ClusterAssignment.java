package com.motaz.rfm.training.dto;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

@Data
@Builder
public class ClusterAssignment {
    private String customerId;
    private LocalDateTime calcDate;
    private int clusterId;
    private Segment segment;
    // recency_days, frequency, monetary and distance_to_centroid
    private Map<String, Object> clusterScore;
}
