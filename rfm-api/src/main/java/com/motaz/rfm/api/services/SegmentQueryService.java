package com.motaz.rfm.api.services;

import com.motaz.rfm.api.dto.SegmentCustomerDto;
import com.motaz.rfm.api.dto.SegmentCustomerPageDto;
import com.motaz.rfm.api.dto.SegmentListResponseDto;
import com.motaz.rfm.api.dto.SegmentStatsDto;
import com.motaz.rfm.api.exception.ResourceNotFoundException;
import com.motaz.rfm.training.dto.Segment;
import com.motaz.rfm.training.model.CustomerClusterEntity;
import com.motaz.rfm.training.model.CustomerEntity;
import com.motaz.rfm.training.model.RfmFeatureEntity;
import com.motaz.rfm.training.repository.CustomerClusterRepository;
import com.motaz.rfm.training.repository.CustomerRepository;
import com.motaz.rfm.training.repository.RfmFeatureRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class SegmentQueryService {

    private final CustomerClusterRepository customerClusterRepository;
    private final RfmFeatureRepository rfmFeatureRepository;
    private final CustomerRepository customerRepository;

    /**
     * Returns the given calc date, or the latest one with stored assignments.
     *
     * @throws ResourceNotFoundException when no run has been stored yet
     */
    @Transactional(readOnly = true)
    public LocalDateTime resolveCalcDate(LocalDateTime calcDate) {
        if (calcDate != null) {
            return calcDate;
        }
        return customerClusterRepository.findLatestCalcDate()
                .orElseThrow(() -> new ResourceNotFoundException("No segments found. Run the pipeline first."));
    }

    @Transactional(readOnly = true)
    public SegmentListResponseDto listSegments(LocalDateTime calcDate) {
        LocalDateTime resolved = resolveCalcDate(calcDate);
        List<SegmentStatsDto> segments = customerClusterRepository.findSegmentStats(resolved)
                .stream()
                .map(stats -> SegmentStatsDto.builder()
                        .segmentName(stats.getSegmentName())
                        .clusterId(stats.getClusterId())
                        .customerCount(stats.getCustomerCount())
                        .avgRecencyDays(orZero(stats.getAvgRecencyDays()))
                        .avgFrequency(orZero(stats.getAvgFrequency()))
                        .avgMonetary(orZero(stats.getAvgMonetary()))
                        .build())
                .toList();
        return SegmentListResponseDto.builder()
                .calcDate(resolved)
                .segments(segments)
                .build();
    }

    /**
     * One page of a segment's customers ordered by customer id, {@code page} is 1-based.
     */
    @Transactional(readOnly = true)
    public SegmentCustomerPageDto segmentCustomers(String requestedName, LocalDateTime calcDate, int page, int pageSize) {
        String segmentName = requireKnownSegment(requestedName);
        LocalDateTime resolved = resolveCalcDate(calcDate);

        Page<CustomerClusterEntity> clusters = customerClusterRepository.findByCalcDateAndSegmentName(
                resolved, segmentName, PageRequest.of(page - 1, pageSize, Sort.by("customerId")));
        List<String> customerIds = clusters.getContent().stream().map(CustomerClusterEntity::getCustomerId).toList();

        Map<String, CustomerEntity> customers = customerRepository.findByCustomerIdIn(customerIds)
                .stream()
                .collect(Collectors.toMap(CustomerEntity::getCustomerId, Function.identity()));
        Map<String, RfmFeatureEntity> features = rfmFeatureRepository.findByCalcDateAndCustomerIdIn(resolved, customerIds)
                .stream()
                .collect(Collectors.toMap(RfmFeatureEntity::getCustomerId, Function.identity()));

        List<SegmentCustomerDto> rows = clusters.getContent().stream()
                .map(cluster -> toCustomerDto(cluster, customers.get(cluster.getCustomerId()),
                        features.get(cluster.getCustomerId())))
                .toList();

        return SegmentCustomerPageDto.builder()
                .segmentName(segmentName)
                .calcDate(resolved)
                .page(page)
                .pageSize(pageSize)
                .totalCustomers(clusters.getTotalElements())
                .customers(rows)
                .build();
    }

    /** Canonical display name of a segment, matched case-insensitively. */
    static String requireKnownSegment(String segmentName) {
        return Segment.fromDisplayName(segmentName)
                .map(Segment::getDisplayName)
                .orElseThrow(() -> new ResourceNotFoundException("Segment", segmentName));
    }

    private static SegmentCustomerDto toCustomerDto(CustomerClusterEntity cluster, CustomerEntity customer,
                                                    RfmFeatureEntity feature) {
        var builder = SegmentCustomerDto.builder()
                .customerId(cluster.getCustomerId())
                .segmentName(cluster.getSegmentName())
                .clusterId(cluster.getClusterId());
        if (customer != null) {
            builder.email(customer.getEmail()).country(customer.getCountry());
        }
        if (feature != null) {
            builder.recencyDays(feature.getRecencyDays())
                    .frequency(feature.getFrequency())
                    .monetary(feature.getMonetary());
        }
        return builder.build();
    }

    private static double orZero(Double value) {
        return value != null ? value : 0.0;
    }
}
