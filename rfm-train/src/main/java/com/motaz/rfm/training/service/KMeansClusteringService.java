package com.motaz.rfm.training.service;

import com.motaz.rfm.training.dto.ClusteringResult;
import com.motaz.rfm.training.dto.StandardizedBatch;
import com.motaz.rfm.training.exception.InvalidParameterException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import smile.math.MathEx;

import java.util.*;
import java.util.stream.IntStream;

@Slf4j
@Getter
@Component
public class KMeansClusteringService {

    private final long seed;
    private final int maxIterations;
    private final double epsilon;

    public KMeansClusteringService(@Value("${rfm.kmeans.seed:42}") long seed,
                                   @Value("${rfm.kmeans.max-iterations:300}") int maxIterations,
                                   @Value("${rfm.kmeans.epsilon:1e-4}") double epsilon) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("rfm.kmeans.max-iterations must be at least 1");
        }
        this.seed = seed;
        this.maxIterations = maxIterations;
        this.epsilon = epsilon;
    }

    public ClusteringResult cluster(StandardizedBatch batch, int k) {
        double[][] data = batch.getValues();
        int n = data.length;
        if (k < 1 || k > n) {
            throw new InvalidParameterException("k", k, "must be between 1 and the number of customers (" + n + ")");
        }

        double[][] centroids = initialCentroids(data, k);
        int[] labels = new int[n];
        int iterations = 0;
        boolean converged = false;

        while (iterations < maxIterations) {
            iterations++;
            final double[][] current = centroids;
            labels = IntStream.range(0, n)
                    .parallel()
                    .map(i -> nearest(data[i], current))
                    .toArray();
            double[][] updated = updateCentroids(data, labels, current);
            double shift = maxShift(current, updated);
            centroids = updated;
            if (shift <= epsilon) {
                converged = true;
                break;
            }
        }

        if (!converged) {
            log.warn("k-means stopped at the iteration cap ({}) before reaching epsilon {}", maxIterations, epsilon);
        }
        double[][] centroidsOriginal = originalCentroids(batch, labels, centroids);
        ClusteringResult result = ClusteringResult.builder()
                .k(k)
                .labels(labels)
                .centroids(centroids)
                .centroidsOriginal(centroidsOriginal)
                .iterations(iterations)
                .converged(converged)
                .build();
        log.info("k-means finished, k: {}, rows: {}, iterations: {}, converged: {}, cluster sizes: {}",
                k, n, iterations, converged, Arrays.toString(result.clusterSizes()));
        return result;
    }

    // member means of the unscaled rows, the back-transformed centroid only for an empty cluster
    static double[][] originalCentroids(StandardizedBatch batch, int[] labels, double[][] centroids) {
        double[][] original = batch.getOriginalValues();
        int k = centroids.length;
        double[][] sums = new double[k][centroids[0].length];
        int[] counts = new int[k];
        for (int i = 0; i < original.length; i++) {
            counts[labels[i]]++;
            for (int d = 0; d < original[i].length; d++) {
                sums[labels[i]][d] += original[i][d];
            }
        }
        double[][] means = new double[k][];
        for (int c = 0; c < k; c++) {
            if (counts[c] == 0) {
                means[c] = batch.inverse(centroids[c]);
                continue;
            }
            means[c] = sums[c];
            for (int d = 0; d < means[c].length; d++) {
                means[c][d] /= counts[c];
            }
        }
        return means;
    }

    /**
     * Picks k rows in seeded shuffle order, skipping rows equal to an already chosen
     * centroid. With fewer than k distinct rows the remaining slots are filled with
     * the skipped rows in the same order.
     */
    double[][] initialCentroids(double[][] data, int k) {
        List<Integer> order = new ArrayList<>(data.length);
        for (int i = 0; i < data.length; i++) order.add(i);
        Collections.shuffle(order, new Random(seed));

        List<double[]> chosen = new ArrayList<>(k);
        List<Integer> duplicates = new ArrayList<>();
        for (int index : order) {
            if (chosen.size() == k) break;
            double[] candidate = data[index];
            boolean seen = chosen.stream().anyMatch(c -> Arrays.equals(c, candidate));
            if (seen) {
                duplicates.add(index);
            } else {
                chosen.add(candidate.clone());
            }
        }
        for (int i = 0; chosen.size() < k; i++) {
            chosen.add(data[duplicates.get(i)].clone());
        }
        return chosen.toArray(new double[0][]);
    }

    static int nearest(double[] x, double[][] centroids) {
        int best = 0;
        double bestDistance = MathEx.squaredDistance(x, centroids[0]);
        for (int c = 1; c < centroids.length; c++) {
            double distance = MathEx.squaredDistance(x, centroids[c]);
            // strict comparison keeps the lowest index on ties
            if (distance < bestDistance) {
                best = c;
                bestDistance = distance;
            }
        }
        return best;
    }

    static double[][] updateCentroids(double[][] data, int[] labels, double[][] previous) {
        int k = previous.length;
        int dims = previous[0].length;
        double[][] sums = new double[k][dims];
        int[] counts = new int[k];
        for (int i = 0; i < data.length; i++) {
            int c = labels[i];
            counts[c]++;
            for (int d = 0; d < dims; d++) {
                sums[c][d] += data[i][d];
            }
        }
        double[][] updated = new double[k][];
        for (int c = 0; c < k; c++) {
            if (counts[c] == 0) {
                updated[c] = previous[c].clone();
                continue;
            }
            updated[c] = new double[dims];
            for (int d = 0; d < dims; d++) {
                updated[c][d] = sums[c][d] / counts[c];
            }
        }
        return updated;
    }

    private static double maxShift(double[][] before, double[][] after) {
        double shift = 0.0;
        for (int c = 0; c < before.length; c++) {
            shift = Math.max(shift, MathEx.distance(before[c], after[c]));
        }
        return shift;
    }
}
