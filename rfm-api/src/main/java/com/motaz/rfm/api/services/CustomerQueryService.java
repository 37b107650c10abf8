package com.motaz.rfm.api.services;

import com.motaz.rfm.api.dto.CustomerClusterDto;
import com.motaz.rfm.api.dto.CustomerDetailDto;
import com.motaz.rfm.api.dto.RfmFeatureDto;
import com.motaz.rfm.api.exception.ResourceNotFoundException;
import com.motaz.rfm.training.model.CustomerEntity;
import com.motaz.rfm.training.repository.CustomerClusterRepository;
import com.motaz.rfm.training.repository.CustomerRepository;
import com.motaz.rfm.training.repository.RfmFeatureRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class CustomerQueryService {

    private final CustomerRepository customerRepository;
    private final RfmFeatureRepository rfmFeatureRepository;
    private final CustomerClusterRepository customerClusterRepository;

    /**
     * Customer details for {@code calcDate}, or for the customer's latest calc date when null.
     */
    @Transactional(readOnly = true)
    public CustomerDetailDto getCustomer(String customerId, LocalDateTime calcDate) {
        CustomerEntity customer = customerRepository.findByCustomerId(customerId)
                .orElseThrow(() -> new ResourceNotFoundException("Customer", customerId));

        var builder = CustomerDetailDto.builder()
                .customerId(customer.getCustomerId())
                .email(customer.getEmail())
                .country(customer.getCountry());

        Optional<LocalDateTime> resolved = calcDate != null
                ? Optional.of(calcDate)
                : rfmFeatureRepository.findLatestCalcDateByCustomerId(customerId);
        if (resolved.isEmpty()) {
            return builder.build();
        }

        rfmFeatureRepository.findByCustomerIdAndCalcDate(customerId, resolved.get())
                .ifPresent(feature -> builder.rfm(RfmFeatureDto.builder()
                        .calcDate(feature.getCalcDate())
                        .windowDays(feature.getWindowDays())
                        .recencyDays(feature.getRecencyDays())
                        .frequency(feature.getFrequency())
                        .monetary(feature.getMonetary())
                        .build()));
        customerClusterRepository.findByCustomerIdAndCalcDate(customerId, resolved.get())
                .ifPresent(cluster -> builder.segment(CustomerClusterDto.builder()
                        .calcDate(cluster.getCalcDate())
                        .clusterId(cluster.getClusterId())
                        .segmentName(cluster.getSegmentName())
                        .clusterScore(cluster.getClusterScore())
                        .build()));
        return builder.build();
    }
}
