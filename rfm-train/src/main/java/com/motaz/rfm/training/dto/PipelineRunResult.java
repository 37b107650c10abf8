package com.motaz.rfm.training.dto;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@Data
@Builder
public class PipelineRunResult {
    private LocalDateTime calcDate;
    private int windowDays;
    private int k;
    private int customersProcessed;
    private int clustersCreated;
    private int iterations;
    private boolean converged;
    private boolean degenerate;
    // segment display name -> customer count, in decision-table order
    private Map<String, Long> segmentCounts;
    private List<String> warnings;
    private List<RfmVector> vectors;
    private List<ClusterAssignment> assignments;
}
