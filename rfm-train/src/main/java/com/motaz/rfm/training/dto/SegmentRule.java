package com.motaz.rfm.training.dto;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.function.BiPredicate;

@Getter
@RequiredArgsConstructor
public class SegmentRule {

    private final Segment segment;
    private final BiPredicate<double[], SegmentThresholds> condition;

    public boolean matches(double[] centroidOriginal, SegmentThresholds thresholds) {
        return condition.test(centroidOriginal, thresholds);
    }
}
