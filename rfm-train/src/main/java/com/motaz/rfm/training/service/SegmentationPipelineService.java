package com.motaz.rfm.training.service;

import com.motaz.rfm.training.dto.*;
import com.motaz.rfm.training.exception.ErrorKind;
import com.motaz.rfm.training.exception.InvalidParameterException;
import com.motaz.rfm.training.exception.NoDataException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import smile.math.MathEx;

import java.time.LocalDateTime;
import java.util.*;

@Slf4j
@Service
@RequiredArgsConstructor
public class SegmentationPipelineService {

    private final CustomerOrderSourceService customerOrderSourceService;
    private final RfmFeatureCalculator rfmFeatureCalculator;
    private final FeatureStandardizer featureStandardizer;
    private final KMeansClusteringService kMeansClusteringService;
    private final SegmentLabeler segmentLabeler;
    private final SegmentationCommitService segmentationCommitService;

    public PipelineRunResult run(LocalDateTime calcDate, int windowDays, int k) {
        log.info("---Start segmentation run calcDate: {}, windowDays: {}, k: {}", calcDate, windowDays, k);
        Objects.requireNonNull(calcDate, "calcDate");
        if (windowDays <= 0) {
            throw new InvalidParameterException("window_days", windowDays, "must be greater than 0");
        }
        if (k < 1) {
            throw new InvalidParameterException("k", k, "must be at least 1");
        }

        Set<String> customerIds = customerOrderSourceService.loadCustomerIds();
        if (customerIds.isEmpty()) {
            throw new NoDataException("No customers available for calcDate " + calcDate);
        }
        List<OrderRecord> orders = customerOrderSourceService.loadOrders(calcDate);
        if (orders.isEmpty()) {
            throw new NoDataException("No orders available up to calcDate " + calcDate);
        }
        if (k > customerIds.size()) {
            throw new InvalidParameterException("k", k,
                    "exceeds the number of distinct customers (" + customerIds.size() + ")");
        }

        log.info("Computing RFM features...");
        List<RfmVector> vectors = rfmFeatureCalculator.calculate(customerIds, orders, calcDate, windowDays);

        log.info("Standardizing features...");
        StandardizedBatch batch = featureStandardizer.standardize(vectors);
        List<String> warnings = new ArrayList<>();
        boolean degenerate = batch.isDegenerate();
        if (degenerate) {
            String warning = ErrorKind.DEGENERATE_INPUT.name() + ": all " + vectors.size()
                    + " customers share an identical RFM vector, clusters carry no information";
            log.warn(warning);
            warnings.add(warning);
        }

        log.info("Clustering with k={}...", k);
        ClusteringResult clustering = kMeansClusteringService.cluster(batch, k);
        if (!clustering.isConverged()) {
            warnings.add("k-means reached the iteration cap of " + clustering.getIterations() + " without converging");
        }

        log.info("Labeling segments...");
        SegmentThresholds thresholds = SegmentThresholds.from(vectors);
        Segment[] clusterSegments = segmentLabeler.labelClusters(clustering.getCentroidsOriginal(), thresholds);

        List<ClusterAssignment> assignments = buildAssignments(calcDate, vectors, batch, clustering, clusterSegments);
        segmentationCommitService.commit(calcDate, windowDays, vectors, assignments);

        Map<String, Long> segmentCounts = countBySegment(assignments);
        log.info("--- Segmentation run completed calcDate: {}, customers: {}, segments: {}",
                calcDate, vectors.size(), segmentCounts);

        return PipelineRunResult.builder()
                .calcDate(calcDate)
                .windowDays(windowDays)
                .k(k)
                .customersProcessed(vectors.size())
                .clustersCreated(k)
                .iterations(clustering.getIterations())
                .converged(clustering.isConverged())
                .degenerate(degenerate)
                .segmentCounts(segmentCounts)
                .warnings(warnings)
                .vectors(vectors)
                .assignments(assignments)
                .build();
    }

    private static List<ClusterAssignment> buildAssignments(LocalDateTime calcDate, List<RfmVector> vectors,
                                                            StandardizedBatch batch, ClusteringResult clustering,
                                                            Segment[] clusterSegments) {
        int[] labels = clustering.getLabels();
        List<ClusterAssignment> assignments = new ArrayList<>(vectors.size());
        for (int i = 0; i < vectors.size(); i++) {
            RfmVector vector = vectors.get(i);
            int clusterId = labels[i];
            double distance = MathEx.distance(batch.row(i), clustering.getCentroids()[clusterId]);

            Map<String, Object> clusterScore = new LinkedHashMap<>();
            clusterScore.put("recency_days", vector.getRecencyDays());
            clusterScore.put("frequency", vector.getFrequency());
            clusterScore.put("monetary", vector.getMonetary());
            clusterScore.put("distance_to_centroid", distance);

            assignments.add(ClusterAssignment.builder()
                    .customerId(vector.getCustomerId())
                    .calcDate(calcDate)
                    .clusterId(clusterId)
                    .segment(clusterSegments[clusterId])
                    .clusterScore(clusterScore)
                    .build());
        }
        return assignments;
    }

    private static Map<String, Long> countBySegment(List<ClusterAssignment> assignments) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Segment segment : Segment.values()) {
            long count = assignments.stream().filter(a -> a.getSegment() == segment).count();
            if (count > 0) {
                counts.put(segment.getDisplayName(), count);
            }
        }
        return counts;
    }
}
