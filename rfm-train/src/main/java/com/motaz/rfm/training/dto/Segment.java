package com.motaz.rfm.training.dto;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

@Getter
@RequiredArgsConstructor
public enum Segment {
    CHAMPIONS("Champions"),
    LOYAL_CUSTOMERS("Loyal Customers"),
    BIG_SPENDERS("Big Spenders"),
    POTENTIAL_LOYALISTS("Potential Loyalists"),
    AT_RISK("At Risk"),
    LOST("Lost"),
    HIBERNATING("Hibernating"),
    NEED_ATTENTION("Need Attention");

    private final String displayName;

    public static Optional<Segment> fromDisplayName(String displayName) {
        return Arrays.stream(values())
                .filter(segment -> segment.displayName.equalsIgnoreCase(displayName))
                .findFirst();
    }
}
