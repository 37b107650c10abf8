package com.motaz.rfm.api.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
public class RfmFeatureDto {
    private LocalDateTime calcDate;
    private Integer windowDays;
    private Integer recencyDays;
    private Integer frequency;
    private BigDecimal monetary;
}
