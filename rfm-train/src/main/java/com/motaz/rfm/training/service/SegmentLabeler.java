package com.motaz.rfm.training.service;

import com.motaz.rfm.training.dto.Segment;
import com.motaz.rfm.training.dto.SegmentRule;
import com.motaz.rfm.training.dto.SegmentThresholds;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.motaz.rfm.training.dto.RfmVector.FREQUENCY;
import static com.motaz.rfm.training.dto.RfmVector.MONETARY;
import static com.motaz.rfm.training.dto.RfmVector.RECENCY;

@Slf4j
@Component
public class SegmentLabeler {

    public static final List<SegmentRule> RULES = List.of(
            new SegmentRule(Segment.CHAMPIONS,
                    (c, t) -> recent(c, t) && c[FREQUENCY] >= t.getMedianFrequency() && c[MONETARY] >= t.getMedianMonetary()),
            new SegmentRule(Segment.LOYAL_CUSTOMERS,
                    (c, t) -> recent(c, t) && c[FREQUENCY] >= t.getMedianFrequency()),
            new SegmentRule(Segment.BIG_SPENDERS,
                    (c, t) -> recent(c, t) && c[MONETARY] >= t.getMedianMonetary()),
            new SegmentRule(Segment.POTENTIAL_LOYALISTS,
                    (c, t) -> recent(c, t) && c[FREQUENCY] > 0),
            new SegmentRule(Segment.AT_RISK,
                    (c, t) -> !recent(c, t) && c[FREQUENCY] < t.getMedianFrequency()),
            new SegmentRule(Segment.LOST,
                    (c, t) -> !recent(c, t)),
            new SegmentRule(Segment.HIBERNATING,
                    (c, t) -> c[FREQUENCY] < t.getMedianFrequency() && c[MONETARY] < t.getMedianMonetary())
    );

    public static final Segment DEFAULT_SEGMENT = Segment.NEED_ATTENTION;

    public Segment label(double[] centroidOriginal, SegmentThresholds thresholds) {
        for (SegmentRule rule : RULES) {
            if (rule.matches(centroidOriginal, thresholds)) {
                return rule.getSegment();
            }
        }
        return DEFAULT_SEGMENT;
    }

    public Segment[] labelClusters(double[][] centroidsOriginal, SegmentThresholds thresholds) {
        Segment[] segments = new Segment[centroidsOriginal.length];
        for (int c = 0; c < centroidsOriginal.length; c++) {
            segments[c] = label(centroidsOriginal[c], thresholds);
            log.info("Cluster {} centroid [r={}, f={}, m={}] -> {}", c,
                    centroidsOriginal[c][RECENCY], centroidsOriginal[c][FREQUENCY], centroidsOriginal[c][MONETARY],
                    segments[c].getDisplayName());
        }
        return segments;
    }

    private static boolean recent(double[] centroid, SegmentThresholds thresholds) {
        return centroid[RECENCY] <= thresholds.getMedianRecency();
    }
}
