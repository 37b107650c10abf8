package com.motaz.rfm.api.dto;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Builder
public class HealthResponseDto {
    private String status;
    private String database;
    private LocalDateTime latestCalcDate;
    private Long totalCustomers;
    private Long totalOrders;
    private Long totalClusterAssignments;
}
