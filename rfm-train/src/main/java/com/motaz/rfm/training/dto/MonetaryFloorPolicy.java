package com.motaz.rfm.training.dto;

import java.math.BigDecimal;

public enum MonetaryFloorPolicy {
    FLOOR_AT_ZERO,
    AS_IS;

    public BigDecimal apply(BigDecimal total) {
        if (this == FLOOR_AT_ZERO && total.signum() < 0) {
            return BigDecimal.ZERO;
        }
        return total;
    }
}
