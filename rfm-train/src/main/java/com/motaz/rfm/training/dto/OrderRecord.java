package com.motaz.rfm.training.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
public class OrderRecord {
    public static final String STATUS_COMPLETED = "completed";

    private String orderId;
    private String customerId;
    private LocalDateTime orderDate;
    private BigDecimal orderAmount;
    private String status;
    // not used for RFM, no currency conversion is performed
    private String currency;

    public boolean isCompleted() {
        return STATUS_COMPLETED.equals(status);
    }
}
