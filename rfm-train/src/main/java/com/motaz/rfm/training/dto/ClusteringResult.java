package com.motaz.rfm.training.dto;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class ClusteringResult {

    private final int k;
    // cluster id per input row
    private final int[] labels;
    private final double[][] centroids;
    private final double[][] centroidsOriginal;
    private final int iterations;
    private final boolean converged;

    public int[] clusterSizes() {
        int[] sizes = new int[k];
        for (int label : labels) {
            sizes[label]++;
        }
        return sizes;
    }
}
