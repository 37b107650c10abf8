package com.motaz.rfm.training.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
public class RfmVector {

    public static final int DIMENSIONS = 3;
    public static final int RECENCY = 0;
    public static final int FREQUENCY = 1;
    public static final int MONETARY = 2;

    private String customerId;
    private int recencyDays;
    private int frequency;
    private BigDecimal monetary;

    /** [recency_days, frequency, monetary] */
    public double[] toFeatureRow() {
        return new double[]{recencyDays, frequency, monetary.doubleValue()};
    }
}
