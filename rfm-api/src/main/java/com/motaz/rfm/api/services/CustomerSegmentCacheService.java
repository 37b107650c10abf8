package com.motaz.rfm.api.services;

import com.motaz.rfm.api.dto.CustomerSegmentDto;
import com.motaz.rfm.api.model.documents.CustomerSegmentDocument;
import com.motaz.rfm.api.repositories.CustomerSegmentDocumentRepository;
import com.motaz.rfm.training.model.CustomerClusterEntity;
import com.motaz.rfm.training.model.RfmFeatureEntity;
import com.motaz.rfm.training.repository.CustomerClusterRepository;
import com.motaz.rfm.training.repository.RfmFeatureRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class CustomerSegmentCacheService {

    static final String ID_PREFIX = "cust:";

    private final CustomerSegmentDocumentRepository customerSegmentDocumentRepository;
    private final CustomerClusterRepository customerClusterRepository;
    private final RfmFeatureRepository rfmFeatureRepository;

    @Transactional(readOnly = true)
    public int cacheLatestSegments() {
        Optional<LocalDateTime> latest = customerClusterRepository.findLatestCalcDate();
        if (latest.isEmpty()) {
            log.info("No segmentation run stored yet, nothing to cache");
            return 0;
        }
        LocalDateTime calcDate = latest.get();
        Map<String, RfmFeatureEntity> features = rfmFeatureRepository.findByCalcDate(calcDate)
                .stream()
                .collect(Collectors.toMap(RfmFeatureEntity::getCustomerId, Function.identity()));

        List<CustomerSegmentDocument> documents = customerClusterRepository.findByCalcDateOrderByCustomerIdAsc(calcDate)
                .stream()
                .map(cluster -> toDocument(cluster, features.get(cluster.getCustomerId())))
                .toList();
        customerSegmentDocumentRepository.saveAll(documents);
        log.info("{} customer segments of calcDate {} cached in Redis..", documents.size(), calcDate);
        return documents.size();
    }

    public Optional<CustomerSegmentDto> findCachedSegment(String customerId) {
        return customerSegmentDocumentRepository.findById(ID_PREFIX + customerId)
                .map(document -> CustomerSegmentDto.builder()
                        .customerId(document.getCustomerId())
                        .segmentName(document.getSegmentName())
                        .clusterId(document.getClusterId())
                        .calcDate(document.getCalcDate())
                        .recencyDays(document.getRecencyDays())
                        .frequency(document.getFrequency())
                        .monetary(document.getMonetary())
                        .build());
    }

    private static CustomerSegmentDocument toDocument(CustomerClusterEntity cluster, RfmFeatureEntity feature) {
        var builder = CustomerSegmentDocument.builder()
                .id(ID_PREFIX + cluster.getCustomerId())
                .customerId(cluster.getCustomerId())
                .segmentName(cluster.getSegmentName())
                .clusterId(cluster.getClusterId())
                .calcDate(cluster.getCalcDate().toString());
        if (feature != null) {
            builder.recencyDays(feature.getRecencyDays())
                    .frequency(feature.getFrequency())
                    .monetary(feature.getMonetary().doubleValue());
        }
        return builder.build();
    }
}
