package com.motaz.rfm.api.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
public class SegmentCustomerDto {
    private String customerId;
    private String email;
    private String country;
    private Integer recencyDays;
    private Integer frequency;
    private BigDecimal monetary;
    private String segmentName;
    private Integer clusterId;
}
