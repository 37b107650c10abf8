package com.motaz.rfm.training.service;

import com.motaz.rfm.training.dto.ClusteringResult;
import com.motaz.rfm.training.dto.RfmVector;
import com.motaz.rfm.training.dto.StandardizedBatch;
import com.motaz.rfm.training.exception.InvalidParameterException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for KMeansClusteringService.
 *
 * Tests verify:
 * - Identical results for the same batch, k and seed
 * - Termination at the iteration cap
 * - Tie breaking and the empty-cluster rule
 */
class KMeansClusteringServiceTest {

    @Test
    @DisplayName("Should produce identical labels and centroids on repeated runs")
    void shouldBeDeterministicForFixedSeed() {
        StandardizedBatch batch = randomBatch(200, 7L);

        ClusteringResult first = new KMeansClusteringService(42L, 300, 1e-4).cluster(batch, 4);
        ClusteringResult second = new KMeansClusteringService(42L, 300, 1e-4).cluster(batch, 4);

        assertThat(second.getLabels()).containsExactly(first.getLabels());
        assertThat(second.getCentroids()).isDeepEqualTo(first.getCentroids());
        assertThat(second.getIterations()).isEqualTo(first.getIterations());
    }

    @Test
    @DisplayName("Should separate two distant groups into two clusters")
    void shouldSeparateDistantGroups() {
        double[][] rows = new double[20][];
        for (int i = 0; i < 10; i++) {
            rows[i] = new double[]{-10 + i * 0.1, 0, 0};
            rows[10 + i] = new double[]{10 + i * 0.1, 0, 0};
        }

        ClusteringResult result = new KMeansClusteringService(42L, 300, 1e-4).cluster(identityBatch(rows), 2);

        int[] labels = result.getLabels();
        for (int i = 1; i < 10; i++) {
            assertThat(labels[i]).isEqualTo(labels[0]);
            assertThat(labels[10 + i]).isEqualTo(labels[10]);
        }
        assertThat(labels[0]).isNotEqualTo(labels[10]);
        assertThat(result.isConverged()).isTrue();
        assertThat(result.clusterSizes()).containsExactlyInAnyOrder(10, 10);
    }

    @Test
    @DisplayName("Should terminate when all vectors are identical")
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void shouldTerminateOnIdenticalVectors() {
        double[][] rows = new double[50][];
        Arrays.setAll(rows, i -> new double[]{0, 0, 0});

        ClusteringResult result = new KMeansClusteringService(42L, 300, 1e-4).cluster(identityBatch(rows), 3);

        assertThat(result.getIterations()).isLessThanOrEqualTo(300);
        assertThat(result.isConverged()).isTrue();
        assertThat(result.getLabels()).containsOnly(0);
        assertThat(result.getCentroids()).hasNumberOfRows(3);
    }

    @Test
    @DisplayName("Should stop at the iteration cap without converging")
    void shouldStopAtIterationCap() {
        double[][] rows = {{0, 0, 0}, {1, 0, 0}, {3, 0, 0}, {10, 0, 0}, {11, 0, 0}, {15, 0, 0}};

        ClusteringResult result = new KMeansClusteringService(42L, 1, 1e-9).cluster(identityBatch(rows), 2);

        assertThat(result.getIterations()).isEqualTo(1);
        assertThat(result.isConverged()).isFalse();
    }

    @Test
    @DisplayName("Should pick k distinct initial centroids")
    void shouldPickDistinctInitialCentroids() {
        double[][] rows = {{1, 1, 1}, {1, 1, 1}, {1, 1, 1}, {2, 2, 2}, {1, 1, 1}, {3, 3, 3}};

        double[][] centroids = new KMeansClusteringService(5L, 300, 1e-4).initialCentroids(rows, 3);

        assertThat(centroids).hasNumberOfRows(3);
        List<String> distinct = new ArrayList<>();
        for (double[] centroid : centroids) distinct.add(Arrays.toString(centroid));
        assertThat(distinct).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("Should break distance ties towards the lowest centroid index")
    void shouldBreakTiesByLowestIndex() {
        double[][] centroids = {{1, 0, 0}, {-1, 0, 0}, {0, 1, 0}};

        assertThat(KMeansClusteringService.nearest(new double[]{0, 0, 0}, centroids)).isZero();
        assertThat(KMeansClusteringService.nearest(new double[]{-0.5, 0.5, 0}, centroids)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep the previous position of a centroid that lost all members")
    void shouldKeepEmptyCentroidInPlace() {
        double[][] data = {{0, 0, 0}, {2, 0, 0}};
        double[][] previous = {{1, 0, 0}, {50, 50, 50}};

        double[][] updated = KMeansClusteringService.updateCentroids(data, new int[]{0, 0}, previous);

        assertThat(updated[0]).containsExactly(1.0, 0.0, 0.0);
        assertThat(updated[1]).containsExactly(50.0, 50.0, 50.0);
        assertThat(updated[1]).isNotSameAs(previous[1]);
    }

    @Test
    @DisplayName("Should report centroids in original units as exact member means")
    void shouldReportOriginalCentroidsAsMemberMeans() {
        List<RfmVector> vectors = List.of(
                vector("C001", 254, 2, "464.78"),
                vector("C002", 254, 2, "464.78"),
                vector("C003", 259, 1, "100.00"),
                vector("C004", 10, 5, "900.00"));
        StandardizedBatch batch = new FeatureStandardizer().standardize(vectors);

        ClusteringResult result = new KMeansClusteringService(42L, 300, 1e-4).cluster(batch, 3);

        int[] labels = result.getLabels();
        assertThat(labels[0]).isEqualTo(labels[1]);
        assertThat(new int[]{labels[0], labels[2], labels[3]}).doesNotHaveDuplicates();
        assertThat(result.getCentroidsOriginal()[labels[0]]).containsExactly(254.0, 2.0, 464.78);
        assertThat(result.getCentroidsOriginal()[labels[3]]).containsExactly(10.0, 5.0, 900.0);
    }

    @Test
    @DisplayName("Should back-transform the centroid of a cluster without members")
    void shouldBackTransformEmptyCluster() {
        double[][] original = {{5, 2, 250}, {366, 0, 0}};
        double[][] standardized = {{-1, 1, 1}, {1, -1, -1}};
        StandardizedBatch batch = new StandardizedBatch(List.of("C001", "C002"), original, standardized,
                new double[]{185.5, 1, 125}, new double[]{180.5, 1, 125});
        double[][] centroids = {{-1, 1, 1}, {1, -1, -1}};

        double[][] centroidsOriginal = KMeansClusteringService.originalCentroids(batch, new int[]{0, 0}, centroids);

        assertThat(centroidsOriginal[0]).containsExactly(185.5, 1.0, 125.0);
        assertThat(centroidsOriginal[1]).containsExactly(366.0, 0.0, 0.0);
    }

    @Test
    @DisplayName("Should reject k outside 1..n")
    void shouldRejectInvalidK() {
        KMeansClusteringService service = new KMeansClusteringService(42L, 300, 1e-4);
        StandardizedBatch batch = randomBatch(3, 1L);

        assertThatThrownBy(() -> service.cluster(batch, 0)).isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> service.cluster(batch, 4)).isInstanceOf(InvalidParameterException.class);
    }

    private static StandardizedBatch identityBatch(double[][] rows) {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < rows.length; i++) ids.add("C" + i);
        return new StandardizedBatch(ids, rows, rows, new double[]{0, 0, 0}, new double[]{1, 1, 1});
    }

    private static RfmVector vector(String customerId, int recencyDays, int frequency, String monetary) {
        return RfmVector.builder()
                .customerId(customerId)
                .recencyDays(recencyDays)
                .frequency(frequency)
                .monetary(new BigDecimal(monetary))
                .build();
    }

    private static StandardizedBatch randomBatch(int n, long seed) {
        Random rnd = new Random(seed);
        double[][] rows = new double[n][];
        for (int i = 0; i < n; i++) {
            rows[i] = new double[]{rnd.nextGaussian(), rnd.nextGaussian(), rnd.nextGaussian()};
        }
        return identityBatch(rows);
    }
}
