package com.motaz.rfm.api.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class CustomerDetailDto {
    private String customerId;
    private String email;
    private String country;
    private RfmFeatureDto rfm;
    private CustomerClusterDto segment;
}
