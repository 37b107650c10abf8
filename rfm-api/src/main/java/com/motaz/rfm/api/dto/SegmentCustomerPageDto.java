package com.motaz.rfm.api.dto;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
public class SegmentCustomerPageDto {
    private String segmentName;
    private LocalDateTime calcDate;
    // 1-based
    private int page;
    private int pageSize;
    private long totalCustomers;
    private List<SegmentCustomerDto> customers;
}
