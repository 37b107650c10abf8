package com.motaz.rfm.training.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class IngestionResult {
    // newly inserted rows, updated rows are not counted
    private int customersIngested;
    private int ordersIngested;
    private List<String> errors;
}
