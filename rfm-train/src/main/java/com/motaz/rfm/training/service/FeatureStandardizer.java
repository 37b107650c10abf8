package com.motaz.rfm.training.service;

import com.motaz.rfm.training.dto.RfmVector;
import com.motaz.rfm.training.dto.StandardizedBatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import smile.math.MathEx;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Slf4j
@Component
public class FeatureStandardizer {

    public StandardizedBatch standardize(List<RfmVector> vectors) {
        int n = vectors.size();
        int dims = RfmVector.DIMENSIONS;
        List<String> customerIds = new ArrayList<>(n);
        double[][] rows = new double[n][];
        for (int i = 0; i < n; i++) {
            customerIds.add(vectors.get(i).getCustomerId());
            rows[i] = vectors.get(i).toFeatureRow();
        }

        double[] means = new double[dims];
        double[] stds = new double[dims];
        for (int d = 0; d < dims; d++) {
            double[] column = column(rows, d);
            if (n == 0) continue;
            means[d] = MathEx.mean(column);
            stds[d] = isConstant(column) ? 0.0 : populationStd(column, means[d]);
        }

        double[][] values = new double[n][dims];
        for (int i = 0; i < n; i++) {
            for (int d = 0; d < dims; d++) {
                values[i][d] = stds[d] == 0.0 ? 0.0 : (rows[i][d] - means[d]) / stds[d];
            }
        }
        log.info("Standardized {} rows, means: {}, stds: {}", n, Arrays.toString(means), Arrays.toString(stds));
        return new StandardizedBatch(customerIds, rows, values, means, stds);
    }

    private static double[] column(double[][] rows, int d) {
        double[] column = new double[rows.length];
        for (int i = 0; i < rows.length; i++) column[i] = rows[i][d];
        return column;
    }

    // exact comparison, a floating point mean of equal values may not reproduce them
    private static boolean isConstant(double[] xs) {
        for (double x : xs) {
            if (x != xs[0]) return false;
        }
        return true;
    }

    private static double populationStd(double[] xs, double mean) {
        double s2 = 0.0;
        for (double x : xs) {
            double delta = x - mean;
            s2 += delta * delta;
        }
        return Math.sqrt(s2 / xs.length);
    }
}
