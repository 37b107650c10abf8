package com.motaz.rfm.training.dto;

import lombok.Builder;
import lombok.Data;

import java.util.Arrays;
import java.util.List;

@Data
@Builder
public class SegmentThresholds {

    private double medianRecency;
    private double medianFrequency;
    private double medianMonetary;

    public static SegmentThresholds from(List<RfmVector> vectors) {
        double[] recency = new double[vectors.size()];
        double[] frequency = new double[vectors.size()];
        double[] monetary = new double[vectors.size()];
        for (int i = 0; i < vectors.size(); i++) {
            double[] row = vectors.get(i).toFeatureRow();
            recency[i] = row[RfmVector.RECENCY];
            frequency[i] = row[RfmVector.FREQUENCY];
            monetary[i] = row[RfmVector.MONETARY];
        }
        return SegmentThresholds.builder()
                .medianRecency(median(recency))
                .medianFrequency(median(frequency))
                .medianMonetary(median(monetary))
                .build();
    }

    static double median(double[] xs) {
        if (xs.length == 0) return 0.0;
        double[] copy = xs.clone();
        Arrays.sort(copy);
        int n = copy.length;
        return n % 2 == 1 ? copy[n / 2] : 0.5 * (copy[n / 2 - 1] + copy[n / 2]);
    }
}
