package com.motaz.rfm.training.dto;

import lombok.Getter;

import java.util.List;

@Getter
public class StandardizedBatch {

    private final List<String> customerIds;
    // [recency, frequency, monetary] before scaling, same row order as values
    private final double[][] originalValues;
    private final double[][] values;
    private final double[] means;
    private final double[] stds;

    public StandardizedBatch(List<String> customerIds, double[][] originalValues, double[][] values,
                             double[] means, double[] stds) {
        this.customerIds = List.copyOf(customerIds);
        this.originalValues = originalValues;
        this.values = values;
        this.means = means;
        this.stds = stds;
    }

    public int size() {
        return values.length;
    }

    public double[] row(int i) {
        return values[i];
    }

    /** Back-transforms {@code x * std + mean}; a zero-variance dimension maps back to its mean. */
    public double[] inverse(double[] standardized) {
        double[] original = new double[standardized.length];
        for (int d = 0; d < standardized.length; d++) {
            original[d] = standardized[d] * stds[d] + means[d];
        }
        return original;
    }

    public boolean isDegenerate() {
        for (double std : stds) {
            if (std != 0.0) {
                return false;
            }
        }
        return true;
    }
}
