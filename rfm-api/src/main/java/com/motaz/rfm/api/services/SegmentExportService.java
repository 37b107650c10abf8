package com.motaz.rfm.api.services;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.motaz.rfm.api.dto.SegmentExportDto;
import com.motaz.rfm.api.exception.ResourceNotFoundException;
import com.motaz.rfm.training.model.CustomerClusterEntity;
import com.motaz.rfm.training.model.CustomerEntity;
import com.motaz.rfm.training.repository.CustomerClusterRepository;
import com.motaz.rfm.training.repository.CustomerRepository;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class SegmentExportService {

    private static final String LINE_END = "\r\n";

    // quotes only values holding a separator, a quote or a line break
    private static final CsvMapper CSV_MAPPER = CsvMapper.builder()
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .build();
    private static final CsvSchema SCHEMA = CSV_MAPPER.schemaFor(SegmentCsvRow.class)
            .withHeader()
            .withLineSeparator(LINE_END);

    private final SegmentQueryService segmentQueryService;
    private final CustomerClusterRepository customerClusterRepository;
    private final CustomerRepository customerRepository;

    @Transactional(readOnly = true)
    public SegmentExportDto exportSegment(String requestedName, LocalDateTime calcDate) {
        String segmentName = SegmentQueryService.requireKnownSegment(requestedName);
        LocalDateTime resolved = segmentQueryService.resolveCalcDate(calcDate);

        List<CustomerClusterEntity> clusters =
                customerClusterRepository.findByCalcDateAndSegmentNameOrderByCustomerIdAsc(resolved, segmentName);
        if (clusters.isEmpty()) {
            throw new ResourceNotFoundException("No customers found in segment '" + segmentName + "' for calcDate " + resolved);
        }
        Map<String, CustomerEntity> customers = customerRepository.findByCustomerIdIn(
                        clusters.stream().map(CustomerClusterEntity::getCustomerId).toList())
                .stream()
                .collect(Collectors.toMap(CustomerEntity::getCustomerId, Function.identity()));

        List<SegmentCsvRow> rows = clusters.stream()
                .map(cluster -> {
                    CustomerEntity customer = customers.get(cluster.getCustomerId());
                    return new SegmentCsvRow(cluster.getCustomerId(),
                            customer != null ? customer.getEmail() : null,
                            customer != null ? customer.getCountry() : null,
                            cluster.getSegmentName());
                })
                .toList();
        String content;
        try {
            content = CSV_MAPPER.writer(SCHEMA).writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to write CSV for segment " + segmentName, e);
        }

        String fileName = "segment_" + segmentName + "_" + resolved.toLocalDate() + ".csv";
        log.info("Exported {} customers of segment '{}' for calcDate {}", clusters.size(), segmentName, resolved);
        return SegmentExportDto.builder()
                .fileName(fileName)
                .content(content)
                .rows(clusters.size())
                .build();
    }

    @Getter
    @AllArgsConstructor
    @JsonPropertyOrder({"customer_id", "email", "country", "segment_name"})
    static class SegmentCsvRow {
        @JsonProperty("customer_id")
        private final String customerId;
        private final String email;
        private final String country;
        @JsonProperty("segment_name")
        private final String segmentName;
    }
}
