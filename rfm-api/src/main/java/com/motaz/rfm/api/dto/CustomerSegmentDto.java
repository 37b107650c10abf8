package com.motaz.rfm.api.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class CustomerSegmentDto {
    private String customerId;
    private String segmentName;
    private Integer clusterId;
    private String calcDate;
    private Integer recencyDays;
    private Integer frequency;
    private Double monetary;
}
