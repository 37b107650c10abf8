package com.motaz.rfm.api.dto;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@Data
@Builder
public class PipelineRunResponseDto {

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_WARNING = "warning";

    private String status;
    private LocalDateTime calcDate;
    private int windowDays;
    private int k;
    private int customersIngested;
    private int ordersIngested;
    private int customersProcessed;
    private int clustersCreated;
    private int iterations;
    private boolean converged;
    private boolean degenerate;
    private Map<String, Long> segmentCounts;
    private List<String> warnings;
    private String message;
}
